package mailqueue.spi;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping persistence errors raised by job stores and repositories.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the underlying SQL error is a unique or integrity constraint violation
     * (SQLState class {@code 23}).
     */
    public boolean isConstraintViolation() {
        Throwable current = getCause();
        while (current != null) {
            if (current instanceof SQLException) {
                String state = ((SQLException) current).getSQLState();
                if (state != null && state.startsWith("23")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
