/**
 *
 */
package org.theseed.traits;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.traits.table.NoSharedTraitsException;
import org.theseed.traits.table.TraitEntry;
import org.theseed.traits.table.TraitTable;
import org.theseed.traits.utils.BaseReportProcessor;
import org.theseed.traits.utils.ParseFailureException;

/**
 * This command computes Spearman rank correlations between the entries of a trait table.  If a reference entry
 * is specified, each other entry is compared to it; otherwise every pair of entries is compared.  The report
 * contains the two entry names and the correlation coefficient.
 *
 * When no trait list is given, the traits of the first entry in each pair are the candidates, so that for a
 * reference comparison the reference entry's traits are used.  Pairs with no traits in common are logged and
 * left out of the report.
 *
 * The positional parameter is the name of the trait table file.  The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report (if not STDOUT)
 *
 * --ref		name of a reference entry to compare against all the others
 * --traits		comma-delimited list of traits to use (default is all of the first entry's traits)
 *
 * @author Bruce Parrello
 *
 */
public class CorrelateProcessor extends BaseReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CorrelateProcessor.class);
    /** trait table being processed */
    private TraitTable table;
    /** list of candidate traits, or NULL to use each pair's own traits */
    private List<String> traitList;

    // COMMAND-LINE OPTIONS

    /** name of the reference entry (if any) */
    @Option(name = "--ref", metaVar = "entry1", usage = "if specified, name of an entry to compare with all the others")
    private String refName;

    /** comma-delimited list of traits to use */
    @Option(name = "--traits", metaVar = "trait1,trait2,trait3", usage = "comma-delimited list of traits to correlate")
    private String traitString;

    /** trait table input file */
    @Argument(index = 0, metaVar = "traits.tab", usage = "trait table input file", required = true)
    private File inFile;

    @Override
    protected void setReporterDefaults() {
        this.refName = null;
        this.traitString = null;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("Trait table file " + this.inFile + " is not found or unreadable.");
        this.table = new TraitTable(this.inFile);
        if (this.traitString == null)
            this.traitList = null;
        else {
            this.traitList = Arrays.asList(StringUtils.split(this.traitString, ','));
            if (this.traitList.isEmpty())
                throw new ParseFailureException("Trait list cannot be empty.");
            for (String trait : this.traitList) {
                if (! this.table.getTraits().contains(trait))
                    log.warn("Trait {} is not in the table headers.", trait);
            }
        }
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        writer.println("entry_1\tentry_2\tspearman");
        int pairCount = 0;
        int failCount = 0;
        if (this.refName != null) {
            // Find the reference entry.
            TraitEntry ref = null;
            for (TraitEntry entry : this.table.getSubset(Collections.singleton(this.refName)))
                ref = entry;
            if (ref == null)
                throw new ParseFailureException("Reference entry " + this.refName + " not found in " + this.inFile + ".");
            log.info("Comparing entries to {}.", ref.getName());
            for (TraitEntry entry : this.table.getExclusion(Collections.singleton(this.refName))) {
                pairCount++;
                if (! this.writePair(writer, ref, entry))
                    failCount++;
            }
        } else {
            // Here we need all the pairs, so we load the whole table.
            List<TraitEntry> entries = new ArrayList<TraitEntry>();
            for (TraitEntry entry : this.table)
                entries.add(entry);
            log.info("{} entries loaded from {}.", entries.size(), this.inFile);
            for (int i = 0; i < entries.size(); i++) {
                TraitEntry entry1 = entries.get(i);
                for (int j = i + 1; j < entries.size(); j++) {
                    pairCount++;
                    if (! this.writePair(writer, entry1, entries.get(j)))
                        failCount++;
                }
            }
        }
        log.info("{} pairs compared, {} had no shared traits.", pairCount, failCount);
    }

    /**
     * Compute and write the correlation for a pair of entries.
     *
     * @param writer	output writer for the report
     * @param entry1	first entry
     * @param entry2	second entry
     *
     * @return TRUE if the correlation was written, FALSE if the entries had no traits in common
     */
    private boolean writePair(PrintWriter writer, TraitEntry entry1, TraitEntry entry2) {
        boolean retVal = true;
        try {
            Collection<String> traits = (this.traitList == null ? entry1.getTraitNames() : this.traitList);
            double corr = entry1.correlation(entry2, traits);
            writer.format("%s\t%s\t%.6f%n", entry1.getName(), entry2.getName(), corr);
        } catch (NoSharedTraitsException e) {
            log.warn(e.getMessage());
            retVal = false;
        }
        return retVal;
    }

}
