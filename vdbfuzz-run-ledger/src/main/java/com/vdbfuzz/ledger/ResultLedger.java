package com.vdbfuzz.ledger;

import com.vdbfuzz.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-safe facade over a {@link ResultSink}. Any exception from the sink is caught, logged, and
 * not rethrown so the run never fails because results could not be recorded.
 */
public final class ResultLedger {

    private static final Logger log = LoggerFactory.getLogger(ResultLedger.class);

    private final ResultSink sink;

    public ResultLedger(ResultSink sink) {
        this.sink = sink != null ? sink : new NoOpResultSink();
    }

    public ResultSink getSink() {
        return sink;
    }

    public void runStarted(RunInfo run) {
        try {
            sink.runStarted(run);
        } catch (Throwable t) {
            log.warn("Ledger runStarted failed (runId={}); run continues. Error: {}", run.getRunId(), t.getMessage(), t);
        }
    }

    public void testCompleted(TestResult result) {
        try {
            sink.testCompleted(result);
        } catch (Throwable t) {
            log.warn("Ledger testCompleted failed (testId={}); run continues. Error: {}",
                    result.getTestCase().getId(), t.getMessage(), t);
        }
    }

    public void runEnded(RunSummary summary) {
        try {
            sink.runEnded(summary);
        } catch (Throwable t) {
            log.warn("Ledger runEnded failed (runId={}); run continues. Error: {}", summary.getRunId(), t.getMessage(), t);
        }
    }
}
