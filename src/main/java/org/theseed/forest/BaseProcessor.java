/**
 *
 */
package org.theseed.forest;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.time.DurationFormatUtils;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for a command processor.  The subclass declares its command-line options and
 * positional parameters using args4j annotations, and then fills in three hooks:  "setDefaults" to
 * initialize the options, "validateParms" to check them, and "runCommand" to do the work.
 *
 * The following command-line options are supported by every processor.
 *
 * -h	display command-line usage
 * -v	display more detailed log messages
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor implements ICommand {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command */
    private long startTime;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    protected boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    protected boolean debug;

    @Override
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help) {
                parser.printUsage(System.err);
            } else {
                if (this.debug) {
                    ch.qos.logback.classic.Logger rootLogger =
                            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    rootLogger.setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        } catch (IOException e) {
            System.err.println(e.getMessage());
        }
        return retVal;
    }

    @Override
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException(e.getMessage(), e);
        }
        log.info("{} to run command.", DurationFormatUtils.formatDuration(System.currentTimeMillis() - this.startTime,
                "mm:ss"));
    }

    /**
     * Read a parameter file.  Each line contains an option, optionally followed by whitespace and a value.
     * Anything after a pound sign is a comment.  Blank lines are skipped.
     *
     * @param parmFile		file to read
     *
     * @return a list of the command-line parameters in the file
     *
     * @throws IOException
     */
    public static List<String> readParmFile(File parmFile) throws IOException {
        List<String> retVal = new ArrayList<String>();
        for (String line : Files.readAllLines(parmFile.toPath(), StandardCharsets.UTF_8)) {
            String data = StringUtils.trimToEmpty(StringUtils.substringBefore(line, "#"));
            if (! data.isEmpty()) {
                String[] pieces = StringUtils.split(data, null, 2);
                retVal.add(pieces[0]);
                if (pieces.length > 1)
                    retVal.add(pieces[1].trim());
            }
        }
        return retVal;
    }

    /**
     * Initialize the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options.
     *
     * @return TRUE if processing can proceed, else FALSE
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
