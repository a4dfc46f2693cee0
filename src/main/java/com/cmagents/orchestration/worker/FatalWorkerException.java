package com.cmagents.orchestration.worker;

/**
 * Unrecoverable worker failure; aborts the run.
 */
public class FatalWorkerException extends RuntimeException {

    public FatalWorkerException(String message) {
        super(message);
    }

    public FatalWorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
