package mailqueue.spi;

/**
 * Raised when the mail provider rejects a call or cannot be reached.
 */
public class MailProviderException extends RuntimeException {
    private final int statusCode;

    public MailProviderException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public MailProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status returned by the provider, or -1 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
