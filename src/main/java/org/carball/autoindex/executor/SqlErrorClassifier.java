package org.carball.autoindex.executor;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;

/**
 * Maps PostgreSQL errors to retry classes by SQLState.
 */
public final class SqlErrorClassifier {

    private SqlErrorClassifier() {
        // Utility class - prevent instantiation
    }

    public static FailureKind classify(SQLException e) {
        String state = e.getSQLState();

        if (e instanceof SQLTimeoutException || "57014".equals(state)) {
            // query_canceled: statement_timeout or an explicit cancel
            return FailureKind.TIMEOUT;
        }
        if (state != null) {
            if (state.equals("55P03")            // lock_not_available
                    || state.equals("40P01")     // deadlock_detected
                    || state.equals("40001")     // serialization_failure
                    || state.equals("57P01")     // admin_shutdown
                    || state.startsWith("08")    // connection exceptions
                    || state.startsWith("53")) { // insufficient resources
                return FailureKind.TRANSIENT;
            }
            return FailureKind.PERMANENT;
        }
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.PERMANENT;
    }

    public static MutationException toMutationException(String action, SQLException e) {
        return new MutationException(classify(e), action + " failed: " + e.getMessage(), e.getSQLState(), e);
    }
}
