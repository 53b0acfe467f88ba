/**
 * Assembly of a fuzzing session.
 * <ul>
 *   <li>{@link com.vdbfuzz.bootstrap.FuzzerBootstrap}: config validation, adapter discovery, sink wiring</li>
 *   <li>{@link com.vdbfuzz.bootstrap.FuzzerContext}: the ready runner plus statistics and meter registry</li>
 * </ul>
 */
package com.vdbfuzz.bootstrap;
