package com.chess.ingest.store;

/**
 * The store could not be reached. Retried with backoff; fatal to an import
 * once retries are exhausted.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
