package org.carball.autoindex.executor;

public enum FailureKind {
    /** Lock contention, deadlock, serialization or connection loss; worth one retry. */
    TRANSIENT,
    /** Privileges, bad definition, unsupported feature; retrying cannot help. */
    PERMANENT,
    /** The build ran past its deadline and was cancelled. */
    TIMEOUT
}
