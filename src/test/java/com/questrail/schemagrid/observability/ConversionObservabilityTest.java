package com.questrail.schemagrid.observability;

import com.questrail.schemagrid.config.ProtocolConfig;
import com.questrail.schemagrid.factory.ProtocolFactory;
import com.questrail.schemagrid.model.GridRow;
import com.questrail.schemagrid.model.SchemaDocument;
import com.questrail.schemagrid.protocol.GridProtocol;
import com.questrail.schemagrid.protocol.WsdlProtocol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionObservabilityTest
{
    private static final SchemaDocument DOC =
            SchemaDocument.of("Order", "urn:orders", List.of(GridRow.of("id", "int")));

    private static GridProtocol recorded(String type, RecordingObservabilitySink sink) {
        return ProtocolFactory.createProtocol(type, ProtocolConfig.builder().withObservabilitySink(sink).build());
    }

    /**
     * Verifies that each contract operation reports exactly one event tagged
     * with the protocol's display name.
     */
    @Test
    void everyOperationReportsOneEvent() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        GridProtocol protocol = recorded("jsonrpc", sink);

        protocol.validateStructure(DOC);
        protocol.generateOutput(DOC);
        protocol.parseInput("{\"method\":\"Order\"}");

        List<ConversionEvent> events = sink.getConversions();
        assertEquals(3, events.size());
        assertEquals(ConversionOperation.VALIDATE, events.get(0).operation());
        assertEquals(ConversionOperation.GENERATE, events.get(1).operation());
        assertEquals(ConversionOperation.PARSE, events.get(2).operation());
        for (ConversionEvent e : events) {
            assertEquals("JSON-RPC", e.protocol());
            assertFalse(e.degraded());
            assertNotNull(e.timestamp());
        }
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void validationEventCarriesErrors() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        recorded("xsd", sink).validateStructure(SchemaDocument.of("", "urn:x", List.of()));

        ConversionEvent event = sink.getConversions(ConversionOperation.VALIDATE).get(0);
        assertFalse(event.degraded());
        assertEquals(List.of("Root element name is required for XSD."), event.detail());
    }

    /**
     * Verifies that generation on an invalid document reports both its own
     * validation pass and a degraded generation.
     */
    @Test
    void refusedGenerationIsDegraded() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        recorded("sap", sink).generateOutput(SchemaDocument.of("", null, List.of()));

        assertEquals(1, sink.getConversions(ConversionOperation.VALIDATE).size());
        ConversionEvent generate = sink.getConversions(ConversionOperation.GENERATE).get(0);
        assertTrue(generate.degraded());
        assertEquals(List.of("IDoc Type (e.g., ORDERS05) is required in the Root Name field."), generate.detail());
    }

    @Test
    void parseFailureRecordsErrorEvent() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        recorded("xsd", sink).parseInput("<xsd:schema/>");

        assertTrue(sink.hasEventOfType(ConversionErrorEvent.class));
        assertEquals("XSD", sink.getErrors().get(0).protocol());
        assertTrue(sink.getConversions(ConversionOperation.PARSE).get(0).degraded());
    }

    @Test
    void schemaCheckIsReportedSeparately() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        WsdlProtocol protocol = new WsdlProtocol(ProtocolConfig.builder().withObservabilitySink(sink).build());

        protocol.validateAgainstSchema("<description/>");

        assertEquals(1, sink.getConversions(ConversionOperation.SCHEMA_CHECK).size());
        assertTrue(sink.getConversions(ConversionOperation.VALIDATE).isEmpty());
    }

    @Test
    void nullSinkDiscardsEvents() {
        GridProtocol protocol = ProtocolFactory.createProtocol("wsdl",
                ProtocolConfig.builder().withObservabilitySink(NullObservabilitySink.INSTANCE).build());

        assertDoesNotThrow(() -> protocol.parseInput("<bad/>"));
    }

    @Test
    void slf4jSinkAcceptsEveryEventShape() {
        Slf4jConversionObservabilitySink sink = new Slf4jConversionObservabilitySink();

        assertDoesNotThrow(() -> {
            sink.onConversion(ConversionEvent.succeeded("WSDL", ConversionOperation.GENERATE));
            sink.onConversion(ConversionEvent.degraded("XSD", ConversionOperation.PARSE, List.of("x")));
            sink.onError(ConversionErrorEvent.of("JSON-RPC", "bad input", new IllegalStateException("cause")));
        });
    }

    /**
     * Verifies that a sink which throws on every event cannot make a
     * contract operation throw.
     */
    @Test
    void failingSinkDoesNotFailOperations() {
        ConversionObservabilitySink failing = new ConversionObservabilitySink() {
            @Override
            public void onConversion(ConversionEvent event) {
                throw new IllegalStateException("sink down");
            }

            @Override
            public void onError(ConversionErrorEvent event) {
                throw new IllegalStateException("sink down");
            }
        };
        GridProtocol protocol = ProtocolFactory.createProtocol("xsd",
                ProtocolConfig.builder().withObservabilitySink(failing).build());

        assertTrue(assertDoesNotThrow(() -> protocol.validateStructure(DOC)).isValid());
        assertTrue(assertDoesNotThrow(() -> protocol.generateOutput(DOC)).contains("<xsd:schema"));
        assertEquals("Failed to parse XSD: Could not find targetNamespace.",
                assertDoesNotThrow(() -> protocol.parseInput("<xsd:element name=\"A\">")).error());
    }

    @Test
    void eventDetailIsCopied() {
        ConversionEvent event = ConversionEvent.degraded("XSD", ConversionOperation.PARSE, null);

        assertEquals(List.of(), event.detail());
    }
}
