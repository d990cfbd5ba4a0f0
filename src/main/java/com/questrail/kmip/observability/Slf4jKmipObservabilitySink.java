package com.questrail.kmip.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of KmipObservabilitySink that emits logs via SLF4J.
 *
 * <p>Successful exchanges log at DEBUG, server-reported failures at WARN and
 * local failures at ERROR.</p>
 */
public final class Slf4jKmipObservabilitySink implements KmipObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jKmipObservabilitySink.class);

    @Override
    public void onExchange(KmipExchangeEvent event) {
        if (event.status().isSuccess()) {
            log.debug("KMIP {}: {} ({} byte(s) sent, {} received)",
                event.operation(),
                event.status(),
                event.bytesSent(),
                event.bytesReceived());
        } else {
            log.warn("KMIP {}: server reported {} (reason {})",
                event.operation(),
                event.status(),
                event.resultReason() != null ? event.resultReason() : "none");
        }
    }

    @Override
    public void onError(KmipErrorEvent event) {
        log.error("KMIP {} failed with {}: {}", event.operation(), event.status(), event.message(), event.cause());
    }
}
