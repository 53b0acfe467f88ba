/**
 * Seedable generator of fuzz test cases: random operations by weight, fuzzed vectors, ids and
 * metadata, and a fixed catalogue of curated edge cases ({@link com.vdbfuzz.generator.EdgeCase}).
 */
package com.vdbfuzz.generator;
