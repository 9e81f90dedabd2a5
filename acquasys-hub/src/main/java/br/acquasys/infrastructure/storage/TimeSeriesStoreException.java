package br.acquasys.infrastructure.storage;

/**
 * Exception thrown when the durable time-series store rejects a write or query.
 */
public class TimeSeriesStoreException extends RuntimeException {

    public TimeSeriesStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
