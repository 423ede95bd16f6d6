/**
 *
 */
package org.theseed.traits;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.traits.table.TraitEntry;
import org.theseed.traits.table.TraitRowWriter;
import org.theseed.traits.table.TraitTable;
import org.theseed.traits.utils.BaseProcessor;
import org.theseed.traits.utils.ParseFailureException;

/**
 * This is the base class for commands that copy entries from a trait table to a new trait table.  The
 * subclass decides which entries are copied and whether the trait columns are put into natural order.
 *
 * The first positional parameter is the name of the input trait table file.  The command-line options
 * are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file (if not STDOUT)
 *
 * --inline		if specified, metadata traits are sorted along with the other traits instead of being placed last
 *
 * @author Bruce Parrello
 *
 */
public abstract class TableCopyProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TableCopyProcessor.class);
    /** input trait table */
    private TraitTable table;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "out.tab", usage = "output file (if not STDOUT)")
    private File outFile;

    /** if specified, metadata traits are not moved to the end */
    @Option(name = "--inline", usage = "if specified, metadata traits are sorted with the other traits")
    private boolean metadataInline;

    /** trait table input file */
    @Argument(index = 0, metaVar = "traits.tab", usage = "trait table input file", required = true)
    private File inFile;

    @Override
    protected final void setDefaults() {
        this.outFile = null;
        this.metadataInline = false;
        this.setCopyDefaults();
    }

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("Trait table file " + this.inFile + " is not found or unreadable.");
        this.table = new TraitTable(this.inFile);
        log.info("Trait table {} has {} traits.", this.inFile, this.table.getTraits().size());
        this.validateCopyParms();
        return true;
    }

    @Override
    protected final void runCommand() throws Exception {
        List<String> traitOrder;
        if (this.isSorted())
            traitOrder = this.table.getOrderedTraits(! this.metadataInline);
        else
            traitOrder = this.table.getTraits();
        try (TraitRowWriter writer = this.openWriter()) {
            writer.writeHeader(this.table.getEntryHeader(), traitOrder);
            for (TraitEntry entry : this.selectEntries(this.table))
                writer.write(entry, traitOrder);
            log.info("{} entries written, {} missing values replaced.", writer.getRowCount(), writer.getMissingCount());
        }
    }

    /**
     * @return a row writer for the output
     *
     * @throws IOException
     */
    private TraitRowWriter openWriter() throws IOException {
        TraitRowWriter retVal;
        if (this.outFile == null) {
            log.info("Output will be to the standard output.");
            retVal = new TraitRowWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        } else {
            log.info("Output will be to {}.", this.outFile);
            retVal = new TraitRowWriter(this.outFile);
        }
        return retVal;
    }

    /**
     * Set the defaults for the subclass's options.
     */
    protected abstract void setCopyDefaults();

    /**
     * Validate the subclass's options.
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract void validateCopyParms() throws IOException, ParseFailureException;

    /**
     * @return TRUE if the output trait columns should be in natural order
     */
    protected abstract boolean isSorted();

    /**
     * @return the entries to copy
     *
     * @param table		input trait table
     */
    protected abstract Iterable<TraitEntry> selectEntries(TraitTable table);

}
