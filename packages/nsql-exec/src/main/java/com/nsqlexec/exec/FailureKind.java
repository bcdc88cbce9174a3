package com.nsqlexec.exec;

/**
 * Why a candidate program produced no answer.
 */
public enum FailureKind {
    /** The program text could not be parsed into a hybrid query. */
    PARSE_ERROR,
    /** Relational evaluation failed: unknown column or table, type mismatch, unsupported construct. */
    EXECUTION_ERROR,
    /** The answer oracle failed or returned an unusable answer. */
    ORACLE_ERROR
}
