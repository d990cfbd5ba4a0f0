/**
 * KMIP Transport Port
 * =============================================================================
 *
 * <p>{@link com.questrail.kmip.transport.KmipTransport} is the
 * framework-agnostic boundary between the exchange engine and whatever
 * carries the bytes (a TLS socket, an in-memory pipe, a test double).</p>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of this port MUST:
 * <ul>
 *   <li>Perform transport I/O only (no frame or message interpretation)</li>
 *   <li>Report the byte counts they actually transferred</li>
 *   <li>Not retry on behalf of the engine</li>
 * </ul>
 *
 * <p>Session establishment and authentication happen before a transport is
 * handed to the client.</p>
 */
package com.questrail.kmip.transport;
