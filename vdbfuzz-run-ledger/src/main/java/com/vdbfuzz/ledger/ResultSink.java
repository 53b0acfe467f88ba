package com.vdbfuzz.ledger;

import com.vdbfuzz.model.TestResult;

/**
 * Consumer of a run's results. Receives {@code runStarted} once, then one
 * {@code testCompleted} per test case in generation order, then {@code runEnded} once.
 * {@link ResultLedger} wraps every call so a failing sink never stops the run.
 */
public interface ResultSink {

    void runStarted(RunInfo run);

    void testCompleted(TestResult result);

    void runEnded(RunSummary summary);
}
