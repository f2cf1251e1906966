package tw.gc.icscore.exceptions;

/**
 * Raised by a metric or event collaborator when a read fails (timeout, malformed row, lost connection).
 * Scoring catches it at the per-ticker boundary and treats the affected metrics as unavailable.
 */
public class MetricRepositoryException extends RuntimeException {

    public MetricRepositoryException(String message) {
        super(message);
    }

    public MetricRepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
