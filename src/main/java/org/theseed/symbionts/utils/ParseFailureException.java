/**
 *
 */
package org.theseed.symbionts.utils;

/**
 * This exception is thrown when a command-line parameter or an input file line cannot be
 * interpreted.
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -4279133287165938627L;

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
