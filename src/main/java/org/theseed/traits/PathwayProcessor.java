/**
 *
 */
package org.theseed.traits;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.theseed.traits.ko.KoPathwayMap;
import org.theseed.traits.ko.LineageKoMap;
import org.theseed.traits.utils.BaseReportProcessor;
import org.theseed.traits.utils.ParseFailureException;

/**
 * This command summarizes a KO lookup file.  Normally the input is a KO metadata file, and the KOs are grouped
 * by pathway at a specified level.  If "--lineage" is specified, the input is a lineage file and the KOs are
 * grouped by lineage.  Each output line contains the group name, the number of KOs, and the KO IDs
 * (semicolon-delimited).
 *
 * The positional parameter is the name of the input file.  The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report (if not STDOUT)
 *
 * --level		pathway level (1, 2, or 3; default 2)
 * --lineage	if specified, the input is a lineage KO file
 *
 * @author Bruce Parrello
 *
 */
public class PathwayProcessor extends BaseReportProcessor {

    // COMMAND-LINE OPTIONS

    /** pathway level */
    @Option(name = "--level", metaVar = "3", usage = "pathway level to use (1 = top, 3 = pathway)")
    private int level;

    /** if specified, the input is a lineage file */
    @Option(name = "--lineage", usage = "if specified, the input file maps lineages to KOs")
    private boolean lineageFlag;

    /** input file */
    @Argument(index = 0, metaVar = "ko_metadata.tab", usage = "KO metadata or lineage input file", required = true)
    private File inFile;

    @Override
    protected void setReporterDefaults() {
        this.level = 2;
        this.lineageFlag = false;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        if (! this.inFile.canRead())
            throw new FileNotFoundException("Input file " + this.inFile + " is not found or unreadable.");
        if (! this.lineageFlag && (this.level < 1 || this.level > KoPathwayMap.MAX_LEVEL))
            throw new ParseFailureException("Level must be 1, 2, or 3.");
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        Map<String, List<String>> groups;
        if (this.lineageFlag) {
            groups = LineageKoMap.load(this.inFile);
            writer.println("lineage\tcount\tkos");
        } else {
            groups = KoPathwayMap.load(this.inFile, this.level);
            writer.println("pathway\tcount\tkos");
        }
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            List<String> kos = group.getValue();
            writer.format("%s\t%d\t%s%n", group.getKey(), kos.size(), StringUtils.join(kos, ';'));
        }
    }

}
