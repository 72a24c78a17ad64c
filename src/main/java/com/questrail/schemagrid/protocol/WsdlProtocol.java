package com.questrail.schemagrid.protocol;

import com.questrail.schemagrid.config.ProtocolConfig;
import com.questrail.schemagrid.internal.xml.XmlExtraction;
import com.questrail.schemagrid.internal.xml.XmlLineWriter;
import com.questrail.schemagrid.model.GridRow;
import com.questrail.schemagrid.model.ParseResult;
import com.questrail.schemagrid.model.SchemaDocument;
import com.questrail.schemagrid.model.ValidationResult;
import com.questrail.schemagrid.observability.ConversionOperation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.questrail.schemagrid.internal.xml.XmlLineWriter.attr;

/**
 * WsdlProtocol
 * =============================================================================
 * Converter between the grid model and WSDL service descriptions, in either
 * WSDL 1.1 or WSDL 2.0 form.
 *
 * <h2>Version</h2>
 * The version is fixed at construction ({@code "2.0"} unless configured).
 * An unrecognised configured version does not fail construction; it is
 * reported by {@link #validateStructure}, and generation falls back to 2.0.
 *
 * <h2>Grid layout</h2>
 * <ul>
 *   <li>A row whose type is {@code complexType} defines a named complex type.</li>
 *   <li>Rows whose {@code structure} names a complex type are its child elements.</li>
 *   <li>Rows with an empty {@code structure} are fields of the root element.</li>
 * </ul>
 *
 * <h2>Generation</h2>
 * Generation is best-effort: it does not refuse invalid grids. Blank fields
 * default to {@code minOccurs="0"}, {@code maxOccurs="1"} and
 * {@code type="xsd:string"}; {@code minOccurs}/{@code maxOccurs} are omitted
 * when equal to {@code "1"}, the XSD default.
 *
 * <h2>Parsing</h2>
 * Parsing is pattern-based and recognises the shapes this class generates
 * plus standalone top-level {@code <xsd:element>} declarations. It never
 * mutates the instance; the detected version is returned in the result.
 */
public final class WsdlProtocol implements GridProtocol
{
    public static final String PROTOCOL_NAME = "WSDL";

    public static final String DEFAULT_VERSION = "2.0";

    private static final List<String> FEATURES_1_1 = List.of(
            "ServiceDefinition",
            "PortTypeDefinition",
            "BindingDefinition",
            "MessageDefinition",
            "TypesDefinition",
            "ComplexTypeDefinition",
            "SimpleTypeDefinition",
            "ElementDeclaration",
            "AttributeDeclaration"
    );

    private static final List<String> FEATURES_2_0 = List.of(
            "ServiceDefinition",
            "InterfaceDefinition",
            "BindingDefinition",
            "MessageDefinition",
            "TypesDefinition",
            "ComplexTypeDefinition",
            "SimpleTypeDefinition",
            "ElementDeclaration",
            "AttributeDeclaration"
    );

    private static final String XSD_NS = "http://www.w3.org/2001/XMLSchema";

    private static final String DEFAULT_MIN_OCCURS = "0";
    private static final String DEFAULT_MAX_OCCURS = "1";
    private static final String DEFAULT_TYPE = "xsd:string";
    private static final String OMITTED_OCCURS = "1";

    // Parsing patterns. The schema prefix may be xsd: or xs:.
    private static final Pattern SERVICE_NAME =
            Pattern.compile("<(?:\\w+:)?service\\s+name=[\"']([^\"']*)[\"']");
    private static final Pattern DOCUMENT_NAME =
            Pattern.compile("<(?:\\w+:)?(?:definitions|description)\\b[^>]*?\\sname=[\"']([^\"']*)[\"']");
    private static final Pattern DOCUMENT_ROOT =
            Pattern.compile("<(?:\\w+:)?(?:definitions|description)\\b");
    private static final Pattern TARGET_NAMESPACE =
            Pattern.compile("targetNamespace=[\"']([^\"']*)[\"']");
    private static final Pattern NAMED_COMPLEX_TYPE =
            Pattern.compile("<xsd?:complexType\\s+name=[\"']([^\"']*)[\"']\\s*>([\\s\\S]*?)</xsd?:complexType>");
    private static final Pattern WRAPPER_ELEMENT =
            Pattern.compile("<xsd?:element\\b[^>]*[^/]>\\s*<xsd?:complexType>([\\s\\S]*?)</xsd?:complexType>\\s*</xsd?:element>");
    private static final Pattern TYPED_ELEMENT =
            Pattern.compile("<xsd?:element\\s+name=[\"']([^\"']*)[\"']\\s+type=[\"']([^\"']*)[\"']([^>]*)>");

    private final String configuredVersion;
    private final WsdlVersion version;
    private final String serviceAddressBase;
    private final OperationReporter reporter;

    public WsdlProtocol() {
        this(ProtocolConfig.defaults());
    }

    public WsdlProtocol(ProtocolConfig config) {
        Objects.requireNonNull(config, "config");
        this.configuredVersion = (config.version() == null) ? DEFAULT_VERSION : config.version();
        this.version = WsdlVersion.fromLabel(configuredVersion).orElse(WsdlVersion.V2_0);
        this.serviceAddressBase = config.serviceAddressBase();
        this.reporter = new OperationReporter(PROTOCOL_NAME, config.observabilitySink());
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.WSDL;
    }

    @Override
    public String getProtocolName() {
        return PROTOCOL_NAME;
    }

    /**
     * Returns the configured version label, which may be unsupported.
     */
    @Override
    public String version() {
        return configuredVersion;
    }

    /**
     * Returns the version generation actually emits.
     */
    public WsdlVersion wsdlVersion() {
        return version;
    }

    @Override
    public List<String> getSupportedFeatures() {
        return version == WsdlVersion.V1_1 ? FEATURES_1_1 : FEATURES_2_0;
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Override
    public ValidationResult validateStructure(SchemaDocument document) {
        if (document == null) {
            return reporter.validated(ValidationResult.invalid("Schema document is required"));
        }

        final List<String> errors = new ArrayList<>();

        if (isNullOrEmpty(document.rootName())) {
            errors.add("Root name is required");
        }
        if (isNullOrEmpty(document.targetNamespace())) {
            errors.add("Target namespace is required for WSDL");
        }
        if (WsdlVersion.fromLabel(configuredVersion).isEmpty()) {
            errors.add("Unsupported WSDL version: " + configuredVersion + ". Supported versions: "
                    + Arrays.stream(WsdlVersion.values()).map(WsdlVersion::label).collect(Collectors.joining(", ")));
        }

        final List<GridRow> rows = document.gridData();
        for (int i = 0; i < rows.size(); i++) {
            final GridRow row = rows.get(i);
            if (row == null) {
                continue;
            }
            final int rowNumber = i + 1;

            if (row.hasName() && !row.hasType()) {
                errors.add("Row " + rowNumber + ": Type is required when name is specified");
            }
            if (!row.hasType()) {
                continue;
            }
            if (!WsdlTypeSystem.isValidType(row.type())) {
                errors.add("Row " + rowNumber + ": Invalid WSDL type '" + row.type() + "'");
            }
            else if (!WsdlTypeSystem.isComplexTypeDefinition(row)
                    && WsdlTypeSystem.isComplexTypeReference(row.type())
                    && !WsdlTypeSystem.complexTypeExists(row.type(), rows)) {
                errors.add("Row " + rowNumber + ": Referenced complex type '" + row.type() + "' not found");
            }
        }

        return reporter.validated(ValidationResult.of(errors));
    }

    /**
     * Returns true if {@code type} is an acceptable WSDL type token: an XSD
     * primitive, an {@code xsd:}/{@code tns:} prefixed name, or a bare
     * complex-type name. Whether a referenced complex type actually exists is
     * checked by {@link #validateStructure}, not here.
     */
    public boolean isValidWSDLType(String type) {
        return WsdlTypeSystem.isValidType(type);
    }

    /**
     * Structural sanity check over WSDL text, independent of the grid model.
     *
     * <p>Verifies that the sections mandatory for this instance's version are
     * present: a {@code definitions} or {@code description} root, {@code types},
     * {@code service}, and for 1.1 also {@code message} and {@code portType}.</p>
     */
    public ValidationResult validateAgainstSchema(String wsdlContent) {
        if (wsdlContent == null) {
            return reporter.validated(ConversionOperation.SCHEMA_CHECK,
                    ValidationResult.invalid("WSDL content is required"));
        }

        final List<String> errors = new ArrayList<>();

        if (!wsdlContent.contains("<definitions") && !wsdlContent.contains("<description")) {
            errors.add("Missing root element: definitions or description");
        }
        if (!wsdlContent.contains("<types>")) {
            errors.add("Missing types section");
        }
        if (version == WsdlVersion.V1_1 && !wsdlContent.contains("<message")) {
            errors.add("Missing message section for WSDL 1.1");
        }
        if (version == WsdlVersion.V1_1 && !wsdlContent.contains("<portType")) {
            errors.add("Missing portType section for WSDL 1.1");
        }
        if (!wsdlContent.contains("<service")) {
            errors.add("Missing service section");
        }

        return reporter.validated(ConversionOperation.SCHEMA_CHECK, ValidationResult.of(errors));
    }

    // ========================================================================
    // Generation
    // ========================================================================

    @Override
    public String generateOutput(SchemaDocument document) {
        final SchemaDocument doc = (document == null) ? SchemaDocument.builder().build() : document;
        final String rootName = nullToEmpty(doc.rootName());
        final String targetNamespace = nullToEmpty(doc.targetNamespace());

        final List<GridRow> filledRows = doc.filledRows();
        final List<GridRow> complexTypeRows = new ArrayList<>();
        final List<GridRow> elementRows = new ArrayList<>();
        for (GridRow row : filledRows) {
            if (WsdlTypeSystem.isComplexTypeDefinition(row)) {
                complexTypeRows.add(row);
            }
            else if (row.hasName()) {
                elementRows.add(row);
            }
        }

        final XmlLineWriter out = new XmlLineWriter().declaration();

        writeRootOpen(out, rootName, targetNamespace);
        writeTypes(out, rootName, targetNamespace, filledRows, complexTypeRows, elementRows);
        if (version == WsdlVersion.V1_1) {
            writeMessages11(out, rootName);
            writePortType11(out, rootName);
            writeBinding11(out, rootName, targetNamespace);
            writeService11(out, rootName);
            out.last("</definitions>");
        }
        else {
            writeInterface20(out, rootName);
            writeBinding20(out, rootName);
            writeService20(out, rootName);
            out.last("</description>");
        }

        final String wsdl = out.toString();
        if (document == null) {
            return reporter.generatedFallback(wsdl, List.of("Schema document is required"));
        }
        return reporter.generated(wsdl);
    }

    private void writeRootOpen(XmlLineWriter out, String rootName, String targetNamespace) {
        if (version == WsdlVersion.V1_1) {
            out.line(0, "<definitions xmlns=\"" + WsdlVersion.V1_1.namespace() + "\"");
            out.line(13, "xmlns:tns=\"" + attr(targetNamespace) + "\"");
            out.line(13, "xmlns:xsd=\"" + XSD_NS + "\"");
            out.line(13, "xmlns:soap=\"http://schemas.xmlsoap.org/wsdl/soap/\"");
        }
        else {
            out.line(0, "<description xmlns=\"" + WsdlVersion.V2_0.namespace() + "\"");
            out.line(13, "xmlns:tns=\"" + attr(targetNamespace) + "\"");
            out.line(13, "xmlns:xsd=\"" + XSD_NS + "\"");
            out.line(13, "xmlns:wsoap=\"http://www.w3.org/ns/wsdl/soap\"");
        }
        out.line(13, "targetNamespace=\"" + attr(targetNamespace) + "\"");
        out.line(13, "name=\"" + attr(rootName) + "\">");
        out.blankLine();
    }

    private void writeTypes(XmlLineWriter out,
                            String rootName,
                            String targetNamespace,
                            List<GridRow> filledRows,
                            List<GridRow> complexTypeRows,
                            List<GridRow> elementRows) {
        out.line(2, "<types>");
        if (version == WsdlVersion.V1_1) {
            out.line(4, "<xsd:schema targetNamespace=\"" + attr(targetNamespace) + "\">");
        }
        else {
            out.line(4, "<xsd:schema targetNamespace=\"" + attr(targetNamespace) + "\"");
            out.line(13, "xmlns:xsd=\"" + XSD_NS + "\">");
        }

        // Complex types first so the root element can reference them.
        for (GridRow complexType : complexTypeRows) {
            out.line(6, "<xsd:complexType name=\"" + attr(complexType.name()) + "\">");
            out.line(8, "<xsd:sequence>");
            for (GridRow child : filledRows) {
                if (child.hasName()
                        && !WsdlTypeSystem.isComplexTypeDefinition(child)
                        && child.structure().equals(complexType.name())) {
                    out.line(10, elementDeclaration(child));
                }
            }
            out.line(8, "</xsd:sequence>");
            out.line(6, "</xsd:complexType>");
        }

        // The root element wraps only true top-level fields. It is identified
        // by id so that it stays distinct from the field declarations it wraps.
        if (!elementRows.isEmpty() || !complexTypeRows.isEmpty()) {
            out.line(6, "<xsd:element id=\"" + attr(rootName) + "\" name=\"" + attr(rootName) + "\">");
            out.line(8, "<xsd:complexType>");
            out.line(10, "<xsd:sequence>");
            for (GridRow row : elementRows) {
                if (row.isTopLevel()) {
                    out.line(12, elementDeclaration(row));
                }
            }
            out.line(10, "</xsd:sequence>");
            out.line(8, "</xsd:complexType>");
            out.line(6, "</xsd:element>");
        }

        out.line(4, "</xsd:schema>");
        out.line(2, "</types>");
        out.blankLine();
    }

    private static String elementDeclaration(GridRow row) {
        final String minOccurs = row.minOccurs().isEmpty() ? DEFAULT_MIN_OCCURS : row.minOccurs();
        final String maxOccurs = row.maxOccurs().isEmpty() ? DEFAULT_MAX_OCCURS : row.maxOccurs();
        final String type = row.type().isEmpty() ? DEFAULT_TYPE : row.type();

        final StringBuilder sb = new StringBuilder("<xsd:element name=\"")
                .append(attr(row.name()))
                .append("\" type=\"")
                .append(attr(type))
                .append('"');
        if (!OMITTED_OCCURS.equals(minOccurs)) {
            sb.append(" minOccurs=\"").append(attr(minOccurs)).append('"');
        }
        if (!OMITTED_OCCURS.equals(maxOccurs)) {
            sb.append(" maxOccurs=\"").append(attr(maxOccurs)).append('"');
        }
        return sb.append(" />").toString();
    }

    private static void writeMessages11(XmlLineWriter out, String rootName) {
        final String root = attr(rootName);
        out.line(2, "<message name=\"" + root + "Request\">");
        out.line(4, "<part name=\"parameters\" element=\"tns:" + root + "\" />");
        out.line(2, "</message>");
        out.blankLine();
        out.line(2, "<message name=\"" + root + "Response\">");
        out.line(4, "<part name=\"parameters\" element=\"tns:" + root + "\" />");
        out.line(2, "</message>");
        out.blankLine();
    }

    private static void writePortType11(XmlLineWriter out, String rootName) {
        final String root = attr(rootName);
        out.line(2, "<portType name=\"" + root + "PortType\">");
        out.line(4, "<operation name=\"" + root + "\">");
        out.line(6, "<input message=\"tns:" + root + "Request\" />");
        out.line(6, "<output message=\"tns:" + root + "Response\" />");
        out.line(4, "</operation>");
        out.line(2, "</portType>");
        out.blankLine();
    }

    private static void writeBinding11(XmlLineWriter out, String rootName, String targetNamespace) {
        final String root = attr(rootName);
        out.line(2, "<binding name=\"" + root + "Binding\" type=\"tns:" + root + "PortType\">");
        out.line(4, "<soap:binding transport=\"http://schemas.xmlsoap.org/soap/http\" style=\"document\" />");
        out.line(4, "<operation name=\"" + root + "\">");
        out.line(6, "<soap:operation soapAction=\"" + attr(targetNamespace) + "/" + root + "\" style=\"document\" />");
        out.line(6, "<input><soap:body use=\"literal\" /></input>");
        out.line(6, "<output><soap:body use=\"literal\" /></output>");
        out.line(4, "</operation>");
        out.line(2, "</binding>");
        out.blankLine();
    }

    private void writeService11(XmlLineWriter out, String rootName) {
        final String root = attr(rootName);
        out.line(2, "<service name=\"" + root + "Service\">");
        out.line(4, "<port name=\"" + root + "Port\" binding=\"tns:" + root + "Binding\">");
        out.line(6, "<soap:address location=\"" + attr(serviceAddressBase) + root + "\" />");
        out.line(4, "</port>");
        out.line(2, "</service>");
        out.blankLine();
    }

    private static void writeInterface20(XmlLineWriter out, String rootName) {
        final String root = attr(rootName);
        out.line(2, "<interface name=\"" + root + "Interface\">");
        out.line(4, "<operation name=\"" + root + "\" pattern=\"http://www.w3.org/ns/wsdl/in-out\">");
        out.line(6, "<input element=\"tns:" + root + "\" />");
        out.line(6, "<output element=\"tns:" + root + "\" />");
        out.line(4, "</operation>");
        out.line(2, "</interface>");
        out.blankLine();
    }

    private static void writeBinding20(XmlLineWriter out, String rootName) {
        final String root = attr(rootName);
        out.line(2, "<binding name=\"" + root + "Binding\" interface=\"tns:" + root + "Interface\"");
        out.line(11, "type=\"http://www.w3.org/ns/wsdl/soap\"");
        out.line(11, "wsoap:protocol=\"http://www.w3.org/2003/05/soap/bindings/HTTP/\">");
        out.line(4, "<operation ref=\"tns:" + root + "\" wsoap:mep=\"http://www.w3.org/2003/05/soap/mep/request-response\" />");
        out.line(2, "</binding>");
        out.blankLine();
    }

    private void writeService20(XmlLineWriter out, String rootName) {
        final String root = attr(rootName);
        out.line(2, "<service name=\"" + root + "Service\" interface=\"tns:" + root + "Interface\">");
        out.line(4, "<endpoint name=\"" + root + "Endpoint\" binding=\"tns:" + root + "Binding\">");
        out.line(6, "<wsoap:address location=\"" + attr(serviceAddressBase) + root + "\" />");
        out.line(4, "</endpoint>");
        out.line(2, "</service>");
        out.blankLine();
    }

    // ========================================================================
    // Parsing
    // ========================================================================

    @Override
    public ParseResult parseInput(String input) {
        if (input == null) {
            return reporter.parsed(ParseResult.failure("No WSDL input provided"));
        }
        if (input.isBlank()) {
            return reporter.parsed(ParseResult.empty());
        }

        final String detectedVersion = WsdlVersion.detect(input)
                .map(WsdlVersion::label)
                .orElse(null);

        final String rootName = extractRootName(input);
        final String targetNamespace = XmlExtraction.firstGroup(TARGET_NAMESPACE, input)
                .map(XmlExtraction::unescape)
                .orElse("");

        final List<GridRow> rows = new ArrayList<>();

        for (MatchResult complexType : XmlExtraction.allMatches(NAMED_COMPLEX_TYPE, input)) {
            final String typeName = XmlExtraction.unescape(complexType.group(1));
            rows.add(GridRow.builder()
                    .id(rows.size())
                    .name(typeName)
                    .type(WsdlTypeSystem.COMPLEX_TYPE)
                    .occurs("1", "1")
                    .build());
            addTypedElements(rows, complexType.group(2), typeName, null);
        }

        final String outsideComplexTypes = XmlExtraction.without(NAMED_COMPLEX_TYPE, input);
        for (MatchResult wrapper : XmlExtraction.allMatches(WRAPPER_ELEMENT, outsideComplexTypes)) {
            addTypedElements(rows, wrapper.group(1), "", null);
        }

        final String standalone = XmlExtraction.without(WRAPPER_ELEMENT, outsideComplexTypes);
        addTypedElements(rows, standalone, "", rootName);

        final ParseResult result = new ParseResult(rootName, targetNamespace, rows, detectedVersion, null);
        if (!DOCUMENT_ROOT.matcher(input).find() && rows.isEmpty()) {
            return reporter.parsed(result.withError("No WSDL definitions or description element found"));
        }
        return reporter.parsed(result);
    }

    /**
     * The service name, or the document name when the service follows the
     * {@code <root>Service} naming this class generates.
     */
    private static String extractRootName(String input) {
        final Optional<String> serviceName = XmlExtraction.firstGroup(SERVICE_NAME, input)
                .map(XmlExtraction::unescape);
        if (serviceName.isEmpty()) {
            return "";
        }
        final Optional<String> documentName = XmlExtraction.firstGroup(DOCUMENT_NAME, input)
                .map(XmlExtraction::unescape);
        if (documentName.isPresent() && serviceName.get().equals(documentName.get() + "Service")) {
            return documentName.get();
        }
        return serviceName.get();
    }

    private static void addTypedElements(List<GridRow> rows, String content, String structure, String excludedName) {
        for (MatchResult element : XmlExtraction.allMatches(TYPED_ELEMENT, content)) {
            final String name = XmlExtraction.unescape(element.group(1));
            if (name.equals(excludedName)) {
                continue;
            }
            final String rest = element.group(3);
            rows.add(GridRow.builder()
                    .id(rows.size())
                    .name(name)
                    .type(XmlExtraction.unescape(element.group(2)))
                    .minOccurs(XmlExtraction.attribute(rest, "minOccurs").orElse(OMITTED_OCCURS))
                    .maxOccurs(XmlExtraction.attribute(rest, "maxOccurs").orElse(OMITTED_OCCURS))
                    .structure(structure)
                    .build());
        }
    }

    private static boolean isNullOrEmpty(String value) {
        return value == null || value.isEmpty();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
