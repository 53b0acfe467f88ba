/**
 * Differential run loop.
 * <ul>
 *   <li>{@link com.vdbfuzz.engine.HealthMonitor}: concurrent probes, one immutable
 *       {@link com.vdbfuzz.engine.HealthSnapshot} per batch</li>
 *   <li>{@link com.vdbfuzz.engine.DifferentialDispatcher}: fan-out of one test case with per-call deadlines</li>
 *   <li>{@link com.vdbfuzz.engine.ResultComparator}: success, overlap, top-hit, count and per-step rules</li>
 *   <li>{@link com.vdbfuzz.engine.FuzzRunner}: batches, collection setup, ledger events, abort on no reachable service</li>
 * </ul>
 */
package com.vdbfuzz.engine;
