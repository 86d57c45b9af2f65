package org.theseed.forest;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.forest.train.CrossValidateProcessor;
import org.theseed.forest.train.TrainProcessor;

/**
 * Main entry point for the random forest utility.  The first parameter is a command-- use "train" to
 * train a forest and test it on a held-out portion of the data, and "xvalidate" to cross-validate a
 * forest on a data file.
 *
 * If the command is followed by an equal sign, then the part after the equal sign should be a file name.
 * The parameters will be read from the file. Otherwise, the parameters are taken from the remainder of
 * the command line.
 *
 *
 * @author Bruce Parrello
 *
 */
public class App
{
    public static void main( String[] args )
    {
        int exitCode = 0;
        try {
            if (args.length < 1)
                throw new ParseFailureException("No command specified.");
            // Parse the command and get the command-line arguments.
            String[] command = StringUtils.split(args[0], '=');
            // Get the rest of the arguments.
            args = Arrays.copyOfRange(args, 1, args.length);
            // Read in the parm file if needed.
            if (command.length == 2) {
                try {
                    // Get the parameters.
                    List<String> buffer = BaseProcessor.readParmFile(new File(command[1]));
                    // Add the residual.
                    buffer.addAll(Arrays.asList(args));
                    args = buffer.toArray(new String[buffer.size()]);
                } catch (IOException e) {
                    throw new UncheckedIOException("Error reading parameter file", e);
                }
            }
            // Compute the appropriate command object.
            ICommand runObject = null;
            boolean success = true;
            switch (command[0]) {
            case "train" :
                runObject = new TrainProcessor();
                success = execute(runObject, args);
                break;
            case "xvalidate" :
                runObject = new CrossValidateProcessor();
                success = execute(runObject, args);
                break;
            case "--help" :
            case "-h" :
            case "help" :
                showHelp();
                break;
            default :
                throw new ParseFailureException("Invalid command code " + command[0] + ".");
            }
            if (! success) exitCode = 255;
        } catch (Exception e) {
            e.printStackTrace();
            exitCode = 255;
        }
        // Force cleanup.
        System.exit(exitCode);
    }

    /**
     * Display all the commands.
     */
    public static void showHelp() {
        System.out.println("Available commands:");
        System.out.println();
        System.out.println("train        train a random forest and test it on held-out data");
        System.out.println("xvalidate    cross-validate a random forest on a data file");
    }

    /**
     * Execute a command processor.
     *
     * @param runObject		command processor to execute
     * @param args			command-line parameters
     *
     * @return TRUE if successful, else FALSE
     */
    public static boolean execute(ICommand runObject, String[] args) {
        // Execute the command.
        boolean retVal = runObject.parseCommand(args);
        if (retVal) {
            runObject.run();
        }
        return retVal;
    }

}
