/**
 * JSON-over-HTTP plumbing shared by the built-in adapters.
 * <ul>
 *   <li>{@link com.vdbfuzz.adapter.http.JsonHttpClient} – request/response transport with error mapping</li>
 *   <li>{@link com.vdbfuzz.adapter.http.HealthProbe} – ranked health endpoints, first ready one wins</li>
 *   <li>{@link com.vdbfuzz.adapter.http.AbstractHttpServiceAdapter} – connect, health and close for HTTP adapters</li>
 * </ul>
 */
package com.vdbfuzz.adapter.http;
