package com.questrail.schemagrid.observability;

/**
 * Receives observability events from protocol operations.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are shared by immutable protocol instances that may be called from
 * several threads at once, so implementations must be thread-safe. An
 * exception thrown by a sink is logged and dropped; it does not fail the
 * operation being reported.</p>
 */
public interface ConversionObservabilitySink {
    /**
     * Called once per completed validate, generate, parse or schema check.
     * @param event the operation outcome
     */
    void onConversion(ConversionEvent event);

    /**
     * Called when a failure is caught and folded into an operation's result.
     * @param event the error event
     */
    void onError(ConversionErrorEvent event);
}
