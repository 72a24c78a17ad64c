package com.questrail.schemagrid.observability;

/**
 * No-op implementation of ConversionObservabilitySink.
 */
public final class NullObservabilitySink implements ConversionObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConversion(ConversionEvent event) {}

    @Override
    public void onError(ConversionErrorEvent event) {}
}
