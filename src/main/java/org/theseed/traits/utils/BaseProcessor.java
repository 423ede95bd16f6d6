/**
 *
 */
package org.theseed.traits.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for a command processor.  The subclass declares its parameters as args4j-annotated
 * fields.  Processing is in three stages:  the defaults are set, the command line is parsed and validated,
 * and the command runs.
 *
 * Every command supports the following options.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor implements Runnable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** TRUE if the command completed successfully */
    private boolean success;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "--help", aliases = { "-h" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "--verbose", aliases = { "-v", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command line.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should not run
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug)
                    setRootLevel(Level.DEBUG);
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        } catch (IOException e) {
            System.err.println(e.toString());
        }
        return retVal;
    }

    /**
     * Set the level of the root logger.
     *
     * @param level		new logging level
     */
    protected static void setRootLevel(Level level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger)
            ((ch.qos.logback.classic.Logger) root).setLevel(level);
    }

    @Override
    public void run() {
        this.success = false;
        try {
            long start = System.currentTimeMillis();
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - start) / 1000.0);
            this.success = true;
        } catch (Exception e) {
            log.error("Error running command.", e);
        }
    }

    /**
     * @return TRUE if the command ran successfully
     */
    public boolean isSuccessful() {
        return this.success;
    }

    /**
     * Set the defaults for the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options.
     *
     * @return TRUE if the command should run, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Run the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
