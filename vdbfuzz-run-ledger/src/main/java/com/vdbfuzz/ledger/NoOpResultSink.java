package com.vdbfuzz.ledger;

import com.vdbfuzz.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sink used when no results file is configured. Logs that the path was hit; nothing is written. */
public final class NoOpResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(NoOpResultSink.class);

    @Override
    public void runStarted(RunInfo run) {
        log.info("Result sink (no-op): runStarted | runId={} | records not persisted (no results file configured)",
                run.getRunId());
    }

    @Override
    public void testCompleted(TestResult result) {
        log.debug("Result sink (no-op): testCompleted | testId={}", result.getTestCase().getId());
    }

    @Override
    public void runEnded(RunSummary summary) {
        log.info("Result sink (no-op): runEnded | runId={} | status={}", summary.getRunId(), summary.getStatus());
    }
}
