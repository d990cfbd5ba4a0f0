package com.questrail.kmip.observability;

/**
 * Main interface for receiving KMIP exchange observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Events never carry key material or request bytes. Implementations are
 * called on the caller's thread and must not throw.</p>
 */
public interface KmipObservabilitySink {
    /**
     * Called when a response was received and classified, including
     * responses in which the server reported a failure.
     * @param event the exchange details
     */
    void onExchange(KmipExchangeEvent event);

    /**
     * Called when an exchange failed locally (allocation, I/O, framing,
     * encoding, decoding or response-shape failures).
     * @param event the error event
     */
    void onError(KmipErrorEvent event);
}
