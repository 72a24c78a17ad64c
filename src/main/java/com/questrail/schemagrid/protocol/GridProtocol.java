package com.questrail.schemagrid.protocol;

import com.questrail.schemagrid.model.ParseResult;
import com.questrail.schemagrid.model.ProtocolDescriptor;
import com.questrail.schemagrid.model.SchemaDocument;
import com.questrail.schemagrid.model.ValidationResult;

import java.util.List;

/**
 * GridProtocol
 * =============================================================================
 * The single contract every wire-format converter implements.
 *
 * <h2>Architectural Role</h2>
 * A protocol converts between the format-independent grid model
 * ({@link SchemaDocument}) and one wire format's text:
 *
 * <pre>
 *   SchemaDocument --validateStructure--> ValidationResult
 *   SchemaDocument --generateOutput-----> wire text
 *   wire text      --parseInput---------> ParseResult
 * </pre>
 *
 * <h2>Closed variant set</h2>
 * The interface is sealed: the set of formats is fixed at compile time and
 * every implementation must provide every operation. New formats are added
 * here, in {@link ProtocolKind}, and in the factory together.
 *
 * <h2>Error channels</h2>
 * <ul>
 *   <li>{@link #validateStructure} returns errors, it never throws, including
 *       for a null document.</li>
 *   <li>{@link #generateOutput} never throws. Depending on the format it either
 *       returns a descriptive error string in place of the wire text, or
 *       proceeds best-effort with defaults. Callers that need a hard failure
 *       signal must validate first.</li>
 *   <li>{@link #parseInput} never throws; failures are carried in
 *       {@link ParseResult#error()} next to a best-effort partial result.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Implementations are immutable after construction and hold no per-call
 * state, so one instance may be used from many threads without locking.
 */
public sealed interface GridProtocol
        permits WsdlProtocol, XsdProtocol, JsonRpcProtocol, SapIdocProtocol
{
    ProtocolKind kind();

    /**
     * Canonical display name, e.g. {@code "WSDL"} or {@code "JSON-RPC"}.
     */
    String getProtocolName();

    /**
     * Format version this instance reads and writes, or null for formats
     * without one.
     */
    String version();

    /**
     * Static, order-stable capability tags.
     */
    List<String> getSupportedFeatures();

    ValidationResult validateStructure(SchemaDocument document);

    String generateOutput(SchemaDocument document);

    ParseResult parseInput(String input);

    default ProtocolDescriptor getDescriptor() {
        return new ProtocolDescriptor(getProtocolName(), version(), getSupportedFeatures());
    }
}
