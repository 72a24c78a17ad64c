package com.questrail.schemagrid.protocol;

import com.questrail.schemagrid.config.ProtocolConfig;
import com.questrail.schemagrid.internal.xml.XmlLineWriter;
import com.questrail.schemagrid.model.GridRow;
import com.questrail.schemagrid.model.SchemaDocument;
import com.questrail.schemagrid.observability.ConversionEvent;
import com.questrail.schemagrid.observability.ConversionOperation;
import com.questrail.schemagrid.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class WsdlGenerationTest
{
    private static WsdlProtocol wsdl(String version) {
        return new WsdlProtocol(ProtocolConfig.builder().withVersion(version).build());
    }

    private static int count(String haystack, String needle) {
        Matcher m = Pattern.compile(Pattern.quote(needle)).matcher(haystack);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    // ---------------------------------------------------------------------
    // WSDL 1.1 layout
    // ---------------------------------------------------------------------

    /**
     * Verifies the 1.1 skeleton: definitions root, request/response messages,
     * portType, SOAP binding and a service whose address is derived from the
     * root name.
     */
    @Test
    void version11EmitsDefinitionsLayout() {
        String out = wsdl("1.1").generateOutput(WsdlTestDocuments.userService());

        assertTrue(out.startsWith(XmlLineWriter.DECLARATION + "\n"));
        assertTrue(out.contains("<definitions xmlns=\"http://schemas.xmlsoap.org/wsdl/\""));
        assertTrue(out.contains("targetNamespace=\"http://example.com/userservice\""));
        assertTrue(out.contains("name=\"UserService\">"));
        assertTrue(out.contains("<message name=\"UserServiceRequest\">"));
        assertTrue(out.contains("<message name=\"UserServiceResponse\">"));
        assertTrue(out.contains("<part name=\"parameters\" element=\"tns:UserService\" />"));
        assertTrue(out.contains("<portType name=\"UserServicePortType\">"));
        assertTrue(out.contains("<binding name=\"UserServiceBinding\" type=\"tns:UserServicePortType\">"));
        assertTrue(out.contains("<soap:operation soapAction=\"http://example.com/userservice/UserService\" style=\"document\" />"));
        assertTrue(out.contains("<service name=\"UserServiceService\">"));
        assertTrue(out.contains("<soap:address location=\"http://example.com/UserService\" />"));
        assertTrue(out.endsWith("</definitions>"));
        assertFalse(out.contains("<interface"));
    }

    // ---------------------------------------------------------------------
    // WSDL 2.0 layout
    // ---------------------------------------------------------------------

    @Test
    void version20EmitsDescriptionLayout() {
        String out = new WsdlProtocol().generateOutput(WsdlTestDocuments.userService());

        assertTrue(out.contains("<description xmlns=\"http://www.w3.org/ns/wsdl\""));
        assertTrue(out.contains("xmlns:wsoap=\"http://www.w3.org/ns/wsdl/soap\""));
        assertTrue(out.contains("<interface name=\"UserServiceInterface\">"));
        assertTrue(out.contains("<operation name=\"UserService\" pattern=\"http://www.w3.org/ns/wsdl/in-out\">"));
        assertTrue(out.contains("<binding name=\"UserServiceBinding\" interface=\"tns:UserServiceInterface\""));
        assertTrue(out.contains("<service name=\"UserServiceService\" interface=\"tns:UserServiceInterface\">"));
        assertTrue(out.contains("<endpoint name=\"UserServiceEndpoint\" binding=\"tns:UserServiceBinding\">"));
        assertTrue(out.contains("<wsoap:address location=\"http://example.com/UserService\" />"));
        assertTrue(out.endsWith("</description>"));
        assertFalse(out.contains("<message"));
        assertFalse(out.contains("<portType"));
    }

    /**
     * Verifies that an unrecognised configured version still produces 2.0 output.
     */
    @Test
    void unknownVersionGeneratesVersion20() {
        String out = wsdl("9.9").generateOutput(WsdlTestDocuments.userService());

        assertTrue(out.contains("<description xmlns=\"http://www.w3.org/ns/wsdl\""));
    }

    // ---------------------------------------------------------------------
    // Element declarations
    // ---------------------------------------------------------------------

    /**
     * Verifies that blank rows are skipped and that each field yields exactly
     * one name-keyed element declaration.
     */
    @Test
    void blankRowsProduceNoElements() {
        String out = new WsdlProtocol().generateOutput(WsdlTestDocuments.userService());

        assertEquals(2, count(out, "<xsd:element name="));
        assertTrue(out.contains("<xsd:element id=\"UserService\" name=\"UserService\">"));
    }

    @Test
    void occursEqualToOneAreOmitted() {
        String out = new WsdlProtocol().generateOutput(WsdlTestDocuments.userService());

        assertTrue(out.contains("<xsd:element name=\"userId\" type=\"xsd:int\" />"));
        assertTrue(out.contains("<xsd:element name=\"userName\" type=\"xsd:string\" minOccurs=\"0\" />"));
    }

    /**
     * Verifies the generation defaults for a row with only a name:
     * type xsd:string, minOccurs 0, maxOccurs 1 (omitted).
     */
    @Test
    void blankFieldsTakeDefaults() {
        SchemaDocument doc = SchemaDocument.of("Notes", "urn:notes",
                List.of(GridRow.of("note", ""), GridRow.builder().name("tags").occurs("2", "5").build()));

        String out = new WsdlProtocol().generateOutput(doc);

        assertTrue(out.contains("<xsd:element name=\"note\" type=\"xsd:string\" minOccurs=\"0\" />"));
        assertTrue(out.contains("<xsd:element name=\"tags\" type=\"xsd:string\" minOccurs=\"2\" maxOccurs=\"5\" />"));
    }

    /**
     * Verifies that rows carrying a type but no name declare nothing, and
     * that a grid made only of such rows has no root element.
     */
    @Test
    void unnamedTypedRowsDeclareNothing() {
        SchemaDocument doc = SchemaDocument.of("Bare", "urn:bare",
                List.of(GridRow.of("", "xsd:int"), GridRow.of("", "xsd:string")));

        String out = new WsdlProtocol().generateOutput(doc);

        assertFalse(out.contains("<xsd:element"));
        assertTrue(out.contains("<service name=\"BareService\""));
    }

    @Test
    void noFieldsMeansNoRootElement() {
        String out = new WsdlProtocol().generateOutput(SchemaDocument.of("Empty", "urn:e", List.of()));

        assertFalse(out.contains("<xsd:element"));
        assertTrue(out.contains("<types>"));
        assertTrue(out.contains("<service name=\"EmptyService\""));
    }

    @Test
    void attributeValuesAreEscaped() {
        SchemaDocument doc = SchemaDocument.of("Svc", "http://example.com/?a=1&b=\"2\"",
                List.of(GridRow.of("field", "xsd:string")));

        String out = new WsdlProtocol().generateOutput(doc);

        assertTrue(out.contains("targetNamespace=\"http://example.com/?a=1&amp;b=&quot;2&quot;\""));
    }

    // ---------------------------------------------------------------------
    // Complex types
    // ---------------------------------------------------------------------

    /**
     * Verifies that complex types are emitted before the root element, hold
     * their own children, and that children never leak into the root element.
     */
    @Test
    void complexTypesPrecedeRootAndOwnTheirChildren() {
        String out = new WsdlProtocol().generateOutput(WsdlTestDocuments.withAddress());

        int complexType = out.indexOf("<xsd:complexType name=\"Address\">");
        int root = out.indexOf("<xsd:element id=\"CustomerService\" name=\"CustomerService\">");
        assertTrue(complexType >= 0);
        assertTrue(root > complexType);

        String typeBody = out.substring(complexType, root);
        assertTrue(typeBody.contains("<xsd:element name=\"street\" type=\"xsd:string\" />"));
        assertTrue(typeBody.contains("<xsd:element name=\"zip\" type=\"xsd:string\" minOccurs=\"0\" />"));

        String rootBody = out.substring(root);
        assertFalse(rootBody.contains("name=\"street\""));
        assertFalse(rootBody.contains("name=\"Address\""));
        assertTrue(rootBody.contains("<xsd:element name=\"customerId\" type=\"xsd:long\" />"));
        assertTrue(rootBody.contains("<xsd:element name=\"home\" type=\"Address\" minOccurs=\"0\" />"));
        assertTrue(rootBody.contains(
                "<xsd:element name=\"previous\" type=\"tns:Address\" minOccurs=\"0\" maxOccurs=\"unbounded\" />"));
    }

    // ---------------------------------------------------------------------
    // Configuration and robustness
    // ---------------------------------------------------------------------

    @Test
    void serviceAddressBaseIsConfigurable() {
        WsdlProtocol protocol = new WsdlProtocol(ProtocolConfig.builder()
                .withVersion("1.1")
                .withServiceAddressBase("https://services.internal/soap/")
                .build());

        String out = protocol.generateOutput(WsdlTestDocuments.userService());

        assertTrue(out.contains("<soap:address location=\"https://services.internal/soap/UserService\" />"));
    }

    /**
     * Verifies that generation is best-effort: a null document yields a
     * skeleton and a degraded event, not an exception.
     */
    @Test
    void nullDocumentGeneratesSkeletonAndReportsDegraded() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        WsdlProtocol protocol = new WsdlProtocol(ProtocolConfig.builder().withObservabilitySink(sink).build());

        String out = assertDoesNotThrow(() -> protocol.generateOutput(null));

        assertTrue(out.contains("<description"));
        assertFalse(out.contains("<xsd:element"));
        List<ConversionEvent> events = sink.getConversions(ConversionOperation.GENERATE);
        assertEquals(1, events.size());
        assertTrue(events.get(0).degraded());
    }

    @Test
    void invalidGridStillGenerates() {
        SchemaDocument doc = SchemaDocument.of("", "", List.of(GridRow.of("x", "foo:bar")));

        String out = new WsdlProtocol().generateOutput(doc);

        assertTrue(out.contains("<xsd:element name=\"x\" type=\"foo:bar\" minOccurs=\"0\" />"));
        assertTrue(out.endsWith("</description>"));
    }

    @Test
    void generationIsDeterministic() {
        WsdlProtocol protocol = new WsdlProtocol();

        assertEquals(protocol.generateOutput(WsdlTestDocuments.withAddress()),
                protocol.generateOutput(WsdlTestDocuments.withAddress()));
    }
}
