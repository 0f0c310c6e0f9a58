package org.carball.autoindex.executor;

import lombok.Getter;

@Getter
public class MutationException extends Exception {

    private final FailureKind kind;
    private final String sqlState;

    public MutationException(FailureKind kind, String message) {
        this(kind, message, null, null);
    }

    public MutationException(FailureKind kind, String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sqlState = sqlState;
    }

    /**
     * Message with the SQLState appended, as written to the mutation log.
     */
    public String getDetail() {
        return sqlState == null ? getMessage() : getMessage() + " [SQLState " + sqlState + "]";
    }
}
