package com.nsqlexec.runner;

/**
 * Creates the private context of a worker, called once per worker on that worker's thread.
 */
public interface WorkerContextFactory {

    WorkerContext create(int workerId);
}
