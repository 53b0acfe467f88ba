/**
 * Micrometer metrics for fuzz runs, recorded as a {@link com.vdbfuzz.ledger.ResultSink}.
 */
package com.vdbfuzz.features.metrics;
