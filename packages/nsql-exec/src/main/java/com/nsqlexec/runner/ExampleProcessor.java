package com.nsqlexec.runner;

import com.nsqlexec.data.Example;
import com.nsqlexec.exec.ExecutionCache;
import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.table.TableStore;
import com.nsqlexec.vote.CandidateOutcome;
import com.nsqlexec.vote.ConsensusResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs all candidate programs of one example (normalize, execute through a per-example cache)
 * and votes on their answers.
 */
public class ExampleProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ExampleProcessor.class);

    public ExampleResult process(Example example, WorkerContext context) {
        TableStore table = example.getTable();
        ExecutionCache cache = new ExecutionCache(table);

        List<ProgramExecution> executions = new ArrayList<>();
        List<CandidateOutcome> candidates = new ArrayList<>();
        for (CandidateProgram program : example.getPrograms()) {
            String normalized = context.getNormalizer().normalize(program.getText(), table);
            ExecutionOutcome outcome = cache.getOrCompute(normalized, table,
                    text -> context.getExecutor().execute(text, table, example.getQuestion()));
            if (outcome.isFailure()) {
                logger.debug("Worker#{}: eid {}, program#{} failed: {}", context.getWorkerId(), example.getEid(),
                        program.getRank(), outcome);
            }
            executions.add(new ProgramExecution(program, normalized, outcome));
            candidates.add(new CandidateOutcome(program, outcome));
        }

        ConsensusResult consensus = context.getAggregator().aggregate(candidates, context.getPolicy());
        logger.debug("Worker#{}: eid {} executed {} programs ({} distinct), answer {}", context.getWorkerId(),
                example.getEid(), executions.size(), cache.size(), consensus.getAnswer());
        return ExampleResult.completed(example.getEid(), example.getQuestion(), example.getGoldAnswer(),
                executions, consensus);
    }
}
