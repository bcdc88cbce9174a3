package com.nsqlexec.runner;

/**
 * A run could not complete because a worker failed outside per-example processing.
 */
public class RunnerException extends Exception {

    public RunnerException(String message) {
        super(message);
    }

    public RunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
