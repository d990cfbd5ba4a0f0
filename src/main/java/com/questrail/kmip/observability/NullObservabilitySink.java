package com.questrail.kmip.observability;

/**
 * No-op implementation of KmipObservabilitySink.
 */
public final class NullObservabilitySink implements KmipObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onExchange(KmipExchangeEvent event) {}

    @Override
    public void onError(KmipErrorEvent event) {}
}
