/**
 * Result recording for a fuzz run.
 * <ul>
 *   <li>{@link com.vdbfuzz.ledger.ResultSink} – receives run start, each test result in order, run end</li>
 *   <li>{@link com.vdbfuzz.ledger.ResultLedger} – fail-safe facade; sink errors are logged, never thrown</li>
 *   <li>{@link com.vdbfuzz.ledger.JsonLinesResultSink} – raw records, one JSON object per line</li>
 *   <li>{@link com.vdbfuzz.ledger.RunStatistics} – totals and the text report</li>
 * </ul>
 */
package com.vdbfuzz.ledger;
