/**
 * Service adapter contract and the provider SPI.
 * <ul>
 *   <li>{@link com.vdbfuzz.adapter.ServiceAdapter} – uniform operations over one vector database</li>
 *   <li>{@link com.vdbfuzz.adapter.AdapterProvider} – ServiceLoader SPI; one provider per service</li>
 *   <li>{@link com.vdbfuzz.adapter.AdapterRegistry} / {@link com.vdbfuzz.adapter.AdapterLoader} – discovery and creation</li>
 *   <li>{@link com.vdbfuzz.adapter.AdapterException} and subclasses – the error taxonomy carried into results</li>
 * </ul>
 */
package com.vdbfuzz.adapter;
