/**
 *
 */
package org.theseed.traits.utils;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.kohsuke.args4j.Option;

/**
 * This is the base class for a command that produces a report.  The report goes to the standard output
 * unless an output file is specified.
 *
 * -o	output file (if not STDOUT)
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseReportProcessor extends BaseProcessor {

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "--output", aliases = { "-o" }, metaVar = "report.tbl", usage = "output file (if not STDOUT)")
    private File outFile;

    @Override
    protected final void setDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        this.validateReporterParms();
        if (this.outFile == null)
            log.info("Report will be written to the standard output.");
        else
            log.info("Report will be written to {}.", this.outFile);
        return true;
    }

    @Override
    protected final void runCommand() throws Exception {
        try (PrintWriter writer = this.openWriter()) {
            this.runReporter(writer);
        }
    }

    /**
     * @return a print writer for the report output
     *
     * @throws IOException
     */
    private PrintWriter openWriter() throws IOException {
        PrintWriter retVal;
        if (this.outFile == null)
            retVal = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        else
            retVal = new PrintWriter(this.outFile, StandardCharsets.UTF_8);
        return retVal;
    }

    /**
     * Set the defaults for the subclass's command-line options.
     */
    protected abstract void setReporterDefaults();

    /**
     * Validate the subclass's command-line options.
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract void validateReporterParms() throws IOException, ParseFailureException;

    /**
     * Produce the report.
     *
     * @param writer	print writer for the report output
     *
     * @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
