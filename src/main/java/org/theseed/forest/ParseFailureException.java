/**
 *
 */
package org.theseed.forest;

/**
 * This exception is thrown when a command's parameters are invalid.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = -3498371946425913286L;

    /**
     * Construct a parse failure with a message.
     *
     * @param message	description of the problem
     */
    public ParseFailureException(String message) {
        super(message);
    }

    /**
     * Construct a parse failure caused by another exception.
     *
     * @param message	description of the problem
     * @param cause		underlying exception
     */
    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
