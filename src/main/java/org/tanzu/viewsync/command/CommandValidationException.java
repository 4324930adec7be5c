package org.tanzu.viewsync.command;

/**
 * Thrown when request input cannot be turned into a {@link ViewerCommand}.
 * The message is returned to the caller verbatim.
 */
public class CommandValidationException extends RuntimeException {

    public CommandValidationException(String message) {
        super(message);
    }
}
