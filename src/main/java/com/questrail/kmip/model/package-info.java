/**
 * KMIP Protocol Structures
 * =============================================================================
 *
 * <p>Typed, immutable representations of the KMIP messages this client sends
 * and receives. These types carry no wire knowledge: tags, TTLV item types,
 * padding and framing belong to {@code com.questrail.kmip.codec}.</p>
 *
 * <h2>Scope</h2>
 * <ul>
 *   <li>Requests: a header plus exactly the Create, Destroy or Get payloads
 *       the exchange engine issues.</li>
 *   <li>Responses: header, batch items with result status/reason/message and
 *       the matching response payloads, including key blocks for Get.</li>
 * </ul>
 *
 * <p>Anything the client does not interpret (other managed object types,
 * transparent key material, unknown fields) is dropped at decode time.</p>
 */
package com.questrail.kmip.model;
