package org.carball.autoindex.audit;

/**
 * The mutation log could not be written. Not recoverable within a cycle: an
 * outcome that is not in the log did not happen as far as operators can tell.
 */
public class AuditWriteException extends RuntimeException {

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
