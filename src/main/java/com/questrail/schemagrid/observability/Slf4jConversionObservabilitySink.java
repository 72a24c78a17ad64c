package com.questrail.schemagrid.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ConversionObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jConversionObservabilitySink implements ConversionObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConversionObservabilitySink.class);

    @Override
    public void onConversion(ConversionEvent event) {
        if (event.degraded()) {
            log.warn("{} {} degraded: {}", event.protocol(), event.operation(), event.detail());
        } else {
            log.debug("{} {} completed", event.protocol(), event.operation());
        }
    }

    @Override
    public void onError(ConversionErrorEvent event) {
        log.error("{} error: {}", event.protocol(), event.message(), event.cause());
    }
}
