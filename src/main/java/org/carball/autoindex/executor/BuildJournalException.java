package org.carball.autoindex.executor;

public class BuildJournalException extends RuntimeException {

    public BuildJournalException(String message, Throwable cause) {
        super(message, cause);
    }
}
