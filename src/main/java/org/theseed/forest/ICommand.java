/**
 *
 */
package org.theseed.forest;

/**
 * This interface describes a command processor that can be invoked from the command dispatcher.
 *
 * @author Bruce Parrello
 *
 */
public interface ICommand {

    /**
     * Parse the command-line parameters.
     *
     * @param args	array of command-line parameters
     *
     * @return TRUE if the parameters are valid and the command can run, else FALSE
     */
    public boolean parseCommand(String[] args);

    /**
     * Run the command.
     */
    public void run();

}
