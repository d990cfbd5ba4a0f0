/**
 * Public entry point of the KMIP client.
 *
 * <p>{@link com.questrail.kmip.client.KmipClient} exposes create, destroy,
 * get-symmetric-key and raw passthrough calls. Each returns a
 * {@link com.questrail.kmip.client.KmipOutcome} whose
 * {@link com.questrail.kmip.client.KmipStatus} distinguishes what the server
 * reported from what went wrong locally.</p>
 */
package com.questrail.kmip.client;
