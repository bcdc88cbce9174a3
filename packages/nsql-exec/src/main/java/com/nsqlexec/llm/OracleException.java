package com.nsqlexec.llm;

/**
 * The answer oracle could not produce a usable answer.
 */
public class OracleException extends Exception {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
