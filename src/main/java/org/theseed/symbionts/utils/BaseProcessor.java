/**
 *
 */
package org.theseed.symbionts.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * This is the base class for all the command processors.  It handles the help and debug
 * options, parses the command line, and runs the command.  Subclasses fill in the defaults,
 * validate the parameters, and do the actual work.
 *
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time in milliseconds */
    private long startTime;
    /** TRUE if the command line was parsed successfully */
    private boolean parsed;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true)
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command line parameters and validate them.
     *
     * @param args	command-line parameters
     *
     * @return TRUE if the command can be run, else FALSE
     */
    public boolean parseCommand(String[] args) {
        this.parsed = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help) {
                parser.printUsage(System.err);
            } else {
                if (this.debug)
                    setLogLevel(Level.DEBUG);
                this.parsed = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        } catch (IOException e) {
            System.err.println(e.toString());
        }
        return this.parsed;
    }

    /**
     * Run the command.  If the command line was not parsed successfully, nothing happens.
     */
    public void run() {
        if (this.parsed) {
            this.startTime = System.currentTimeMillis();
            try {
                this.runCommand();
                log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
            } catch (Exception e) {
                log.error("Command failed.", e);
                System.exit(1);
            }
        }
    }

    /**
     * Set the level of the root logger.
     *
     * @param level		new logging level
     */
    public static void setLogLevel(Level level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
            LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
            loggerContext.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }

    /**
     * Display the list of commands on the standard error output.
     *
     * @param commands	array of alternating command names and descriptions
     */
    public static void showCommands(String[] commands) {
        System.err.println("Available commands:");
        for (int i = 0; i < commands.length; i += 2)
            System.err.format("  %-12s %s%n", commands[i], commands[i+1]);
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options and parameters.
     *
     * @return TRUE if it is valid to run the command, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
