package com.nsqlexec.runner;

import com.nsqlexec.exec.HybridExecutor;
import com.nsqlexec.program.QueryNormalizer;
import com.nsqlexec.vote.ConsensusAggregator;
import com.nsqlexec.vote.VotePolicy;

/**
 * Everything one worker needs to process its examples. Created once per worker and passed to
 * every call; never shared between workers.
 */
public class WorkerContext {

    private final int workerId;
    private final QueryNormalizer normalizer;
    private final HybridExecutor executor;
    private final ConsensusAggregator aggregator;
    private final VotePolicy policy;

    public WorkerContext(int workerId, QueryNormalizer normalizer, HybridExecutor executor,
                         ConsensusAggregator aggregator, VotePolicy policy) {
        this.workerId = workerId;
        this.normalizer = normalizer;
        this.executor = executor;
        this.aggregator = aggregator;
        this.policy = policy;
    }

    public int getWorkerId() { return workerId; }
    public QueryNormalizer getNormalizer() { return normalizer; }
    public HybridExecutor getExecutor() { return executor; }
    public ConsensusAggregator getAggregator() { return aggregator; }
    public VotePolicy getPolicy() { return policy; }
}
