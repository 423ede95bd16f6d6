/**
 *
 */
package org.theseed.traits.table;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.text.TextStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object writes trait entries to a tab-delimited output stream.  Each row contains the entry name
 * followed by the values of the traits in a caller-specified order.  If an entry does not have one of
 * the traits, "NA" is written in its place and a warning is logged.
 *
 * @author Bruce Parrello
 *
 */
public class TraitRowWriter implements AutoCloseable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TraitRowWriter.class);
    /** output writer */
    private PrintWriter writer;
    /** number of rows written */
    private int rowCount;
    /** number of missing values replaced */
    private int missingCount;
    /** placeholder for a missing trait value */
    public static final String MISSING = "NA";

    /**
     * Construct a row writer for an output file.
     *
     * @param outFile	file to receive the output
     *
     * @throws IOException
     */
    public TraitRowWriter(File outFile) throws IOException {
        this(new PrintWriter(outFile, StandardCharsets.UTF_8));
    }

    /**
     * Construct a row writer for an open output stream.
     *
     * @param writer	writer to receive the output
     */
    public TraitRowWriter(Writer writer) {
        if (writer instanceof PrintWriter)
            this.writer = (PrintWriter) writer;
        else
            this.writer = new PrintWriter(writer);
        this.rowCount = 0;
        this.missingCount = 0;
    }

    /**
     * Write a header line.  The entry column label is prefixed with the comment marker.
     *
     * @param entryHeader	label for the entry name column
     * @param traitOrder	names of the traits, in output order
     */
    public void writeHeader(String entryHeader, List<String> traitOrder) {
        TextStringBuilder buffer = new TextStringBuilder(20 * (traitOrder.size() + 1));
        buffer.append(TraitTable.COMMENT_MARKER).append(entryHeader);
        for (String trait : traitOrder)
            buffer.append('\t').append(trait);
        this.writer.println(buffer.toString());
    }

    /**
     * Write an entry as a data row.
     *
     * @param entry			entry to write
     * @param traitOrder	names of the traits to write, in order
     *
     * @return the text of the row written (without the line terminator)
     */
    public String write(TraitEntry entry, List<String> traitOrder) {
        String retVal = this.formatRow(entry, traitOrder);
        this.writer.println(retVal);
        this.rowCount++;
        return retVal;
    }

    /**
     * Format an entry as a data row without writing it.
     *
     * @param entry			entry to format
     * @param traitOrder	names of the traits to include, in order
     *
     * @return the text of the row
     */
    public String formatRow(TraitEntry entry, List<String> traitOrder) {
        TextStringBuilder buffer = new TextStringBuilder(20 * (traitOrder.size() + 1));
        buffer.append(entry.getName());
        for (String trait : traitOrder) {
            buffer.append('\t');
            TraitValue value = entry.getValue(trait);
            if (value != null)
                buffer.append(value.render());
            else {
                log.warn("{} doesn't have trait {}.  Writing \"{}\".", entry, trait, MISSING);
                this.missingCount++;
                buffer.append(MISSING);
            }
        }
        return buffer.toString();
    }

    /**
     * @return the number of rows written
     */
    public int getRowCount() {
        return this.rowCount;
    }

    /**
     * @return the number of missing values replaced by the placeholder
     */
    public int getMissingCount() {
        return this.missingCount;
    }

    /**
     * Flush the output without closing it.
     */
    public void flush() {
        this.writer.flush();
    }

    @Override
    public void close() {
        this.writer.close();
    }

}
