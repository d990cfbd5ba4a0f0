/**
 * The blocking exchange engine behind {@link com.questrail.kmip.client.KmipClient}.
 *
 * <p>{@link com.questrail.kmip.internal.exchange.ExchangeOrchestrator} drives
 * one exchange at a time through a
 * {@link com.questrail.kmip.internal.exchange.ProtocolContext}: the
 * {@link com.questrail.kmip.internal.exchange.FrameTransmitter} encodes into a
 * growing working buffer and writes it, the
 * {@link com.questrail.kmip.internal.exchange.FrameReceiver} reads the 8-byte
 * prefix and then exactly the declared body, and the per-operation
 * {@link com.questrail.kmip.internal.exchange.ExchangeOperation} extracts the
 * caller's output from the sole batch item.</p>
 *
 * <p>Failures travel as the checked
 * {@link com.questrail.kmip.internal.exchange.ExchangeException} and stop at
 * the orchestrator. Nothing in this package is API.</p>
 */
package com.questrail.kmip.internal.exchange;
