package com.cmagents.orchestration.worker;

/**
 * Recoverable worker failure; the engine retries it a bounded number of times.
 */
public class TransientWorkerException extends RuntimeException {

    public TransientWorkerException(String message) {
        super(message);
    }

    public TransientWorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
