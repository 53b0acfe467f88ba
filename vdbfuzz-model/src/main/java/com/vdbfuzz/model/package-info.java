/**
 * Value types shared by every module. All types are immutable and serialise with Jackson.
 * <ul>
 *   <li>{@link com.vdbfuzz.model.TestCase} – one generated operation with its {@link com.vdbfuzz.model.OperationParams}</li>
 *   <li>{@link com.vdbfuzz.model.DatabaseResult} – outcome on one service: normalised {@link com.vdbfuzz.model.ResultData} or a {@link com.vdbfuzz.model.ResultError}</li>
 *   <li>{@link com.vdbfuzz.model.Inconsistency} – classified disagreement ({@link com.vdbfuzz.model.InconsistencyKind}, {@link com.vdbfuzz.model.DivergenceRule})</li>
 *   <li>{@link com.vdbfuzz.model.TestResult} – the persisted per-test record</li>
 * </ul>
 */
package com.vdbfuzz.model;
