/**
 * Observability port of the KMIP client.
 *
 * <p>The exchange engine reports every finished call to a
 * {@link com.questrail.kmip.observability.KmipObservabilitySink}. The default
 * is {@link com.questrail.kmip.observability.NullObservabilitySink};
 * {@link com.questrail.kmip.observability.Slf4jKmipObservabilitySink} routes
 * events to SLF4J.</p>
 */
package com.questrail.kmip.observability;
