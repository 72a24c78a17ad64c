package com.questrail.schemagrid.protocol;

import com.questrail.schemagrid.model.ParseResult;
import com.questrail.schemagrid.model.ValidationResult;
import com.questrail.schemagrid.observability.ConversionErrorEvent;
import com.questrail.schemagrid.observability.ConversionEvent;
import com.questrail.schemagrid.observability.ConversionObservabilitySink;
import com.questrail.schemagrid.observability.ConversionOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Forwards operation outcomes of one protocol instance to its observability
 * sink. Each method returns its argument so call sites can report inline.
 *
 * <p>Reporting is best-effort: an exception thrown by the sink is logged and
 * dropped so it never escapes a contract operation.</p>
 */
final class OperationReporter
{
    private static final Logger log = LoggerFactory.getLogger(OperationReporter.class);

    private final String protocol;
    private final ConversionObservabilitySink sink;

    OperationReporter(String protocol, ConversionObservabilitySink sink) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    ValidationResult validated(ValidationResult result) {
        return validated(ConversionOperation.VALIDATE, result);
    }

    ValidationResult validated(ConversionOperation operation, ValidationResult result) {
        emit(new ConversionEvent(Instant.now(), protocol, operation, false, result.errors()));
        return result;
    }

    String generated(String output) {
        emit(ConversionEvent.succeeded(protocol, ConversionOperation.GENERATE));
        return output;
    }

    String generatedFallback(String output, List<String> reasons) {
        emit(ConversionEvent.degraded(protocol, ConversionOperation.GENERATE, reasons));
        return output;
    }

    ParseResult parsed(ParseResult result) {
        if (result.hasError()) {
            emit(ConversionEvent.degraded(protocol, ConversionOperation.PARSE, List.of(result.error())));
        } else {
            emit(ConversionEvent.succeeded(protocol, ConversionOperation.PARSE));
        }
        return result;
    }

    void error(String message, Throwable cause) {
        final ConversionErrorEvent event = ConversionErrorEvent.of(protocol, message, cause);
        try {
            sink.onError(event);
        }
        catch (RuntimeException e) {
            log.warn("{} observability sink failed on error event", protocol, e);
        }
    }

    private void emit(ConversionEvent event) {
        try {
            sink.onConversion(event);
        }
        catch (RuntimeException e) {
            log.warn("{} observability sink failed on {} event", protocol, event.operation(), e);
        }
    }
}
