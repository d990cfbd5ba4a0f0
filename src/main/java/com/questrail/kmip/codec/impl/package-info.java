/**
 * Default TTLV codec.
 *
 * <p>Implements the KMIP Tag-Type-Length-Value encoding for the request and
 * response structures this client exchanges. Tags, item types, padding and
 * nesting limits are private to this package.</p>
 */
package com.questrail.kmip.codec.impl;
