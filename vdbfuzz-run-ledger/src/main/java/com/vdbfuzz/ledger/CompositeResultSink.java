package com.vdbfuzz.ledger;

import com.vdbfuzz.model.TestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans every event out to several sinks in order. A sink that throws is logged and skipped so the
 * others still receive the event.
 */
public final class CompositeResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(CompositeResultSink.class);

    private final List<ResultSink> sinks;

    public CompositeResultSink(List<ResultSink> sinks) {
        this.sinks = sinks != null ? List.copyOf(sinks) : List.of();
    }

    public List<ResultSink> getSinks() {
        return sinks;
    }

    @Override
    public void runStarted(RunInfo run) {
        for (ResultSink sink : sinks) {
            try {
                sink.runStarted(run);
            } catch (RuntimeException e) {
                log.warn("Sink {} runStarted failed (runId={}): {}", name(sink), run.getRunId(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void testCompleted(TestResult result) {
        for (ResultSink sink : sinks) {
            try {
                sink.testCompleted(result);
            } catch (RuntimeException e) {
                log.warn("Sink {} testCompleted failed (testId={}): {}", name(sink), result.getTestCase().getId(),
                        e.getMessage(), e);
            }
        }
    }

    @Override
    public void runEnded(RunSummary summary) {
        for (ResultSink sink : sinks) {
            try {
                sink.runEnded(summary);
            } catch (RuntimeException e) {
                log.warn("Sink {} runEnded failed (runId={}): {}", name(sink), summary.getRunId(), e.getMessage(), e);
            }
        }
    }

    private static String name(ResultSink sink) {
        return sink.getClass().getSimpleName();
    }
}
