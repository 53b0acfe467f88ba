/**
 * Run configuration. {@link com.vdbfuzz.config.FuzzerConfig} is immutable and passed explicitly;
 * there is no process-wide configuration state.
 */
package com.vdbfuzz.config;
