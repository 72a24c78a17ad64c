package com.questrail.schemagrid.protocol;

import com.questrail.schemagrid.config.ProtocolConfig;
import com.questrail.schemagrid.internal.xml.XmlExtraction;
import com.questrail.schemagrid.internal.xml.XmlLineWriter;
import com.questrail.schemagrid.model.GridRow;
import com.questrail.schemagrid.model.ParseResult;
import com.questrail.schemagrid.model.SchemaDocument;
import com.questrail.schemagrid.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

import static com.questrail.schemagrid.internal.xml.XmlLineWriter.attr;

/**
 * XsdProtocol
 * -----------------------------------------------------------------------------
 * Single-level converter between the grid and an XML Schema document.
 *
 * <p>The schema declares one root element whose anonymous complex type holds a
 * sequence of child elements, one per named and typed row. Unlike WSDL, both
 * {@code minOccurs} and {@code maxOccurs} default to {@code "1"} and are always
 * written.</p>
 *
 * <p>Generation refuses invalid documents: it returns
 * {@code "Error generating XSD: <errors>"} in place of the schema.</p>
 */
public final class XsdProtocol implements GridProtocol
{
    public static final String PROTOCOL_NAME = "XSD";

    private static final List<String> FEATURES = List.of("SchemaGeneration", "SchemaParsing");

    private static final String XSD_PREFIX = "xsd:";
    private static final String DEFAULT_OCCURS = "1";

    private static final Pattern ROOT_ELEMENT = Pattern.compile("<xsd:element name=\"([^\"]+)\">");
    private static final Pattern TARGET_NAMESPACE = Pattern.compile("targetNamespace=\"([^\"]+)\"");
    private static final Pattern SEQUENCE = Pattern.compile("<xsd:sequence>([\\s\\S]*?)</xsd:sequence>");
    private static final Pattern SEQUENCE_ELEMENT =
            Pattern.compile("<xsd:element\\s+name=\"([^\"]+)\"\\s+type=\"([^\"]+)\"([^>]*)>");

    private final OperationReporter reporter;

    public XsdProtocol() {
        this(ProtocolConfig.defaults());
    }

    public XsdProtocol(ProtocolConfig config) {
        Objects.requireNonNull(config, "config");
        this.reporter = new OperationReporter(PROTOCOL_NAME, config.observabilitySink());
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.XSD;
    }

    @Override
    public String getProtocolName() {
        return PROTOCOL_NAME;
    }

    @Override
    public String version() {
        return "1.0";
    }

    @Override
    public List<String> getSupportedFeatures() {
        return FEATURES;
    }

    @Override
    public ValidationResult validateStructure(SchemaDocument document) {
        if (document == null) {
            return reporter.validated(ValidationResult.invalid("Schema document is required"));
        }

        final List<String> errors = new ArrayList<>();
        if (isBlank(document.rootName())) {
            errors.add("Root element name is required for XSD.");
        }
        if (isBlank(document.targetNamespace())) {
            errors.add("Target namespace is required for XSD.");
        }

        final List<GridRow> rows = document.gridData();
        for (int i = 0; i < rows.size(); i++) {
            final GridRow row = rows.get(i);
            if (row == null) {
                continue;
            }
            final boolean hasName = !row.name().isBlank();
            final boolean hasType = !row.type().isBlank();
            if (hasName && !hasType) {
                errors.add("Row " + (i + 1) + ": Type is required for element '" + row.name() + "'.");
            }
            if (!hasName && hasType) {
                errors.add("Row " + (i + 1) + ": Name is required if a type is specified.");
            }
        }

        return reporter.validated(ValidationResult.of(errors));
    }

    @Override
    public String generateOutput(SchemaDocument document) {
        final ValidationResult validation = validateStructure(document);
        if (!validation.isValid()) {
            return reporter.generatedFallback(
                    "Error generating XSD: " + validation.joinedErrors(), validation.errors());
        }

        final String targetNamespace = attr(document.targetNamespace());
        final XmlLineWriter out = new XmlLineWriter().declaration();
        out.line(0, "<xsd:schema xmlns:xsd=\"http://www.w3.org/2001/XMLSchema\"");
        out.line(12, "targetNamespace=\"" + targetNamespace + "\"");
        out.line(12, "xmlns:tns=\"" + targetNamespace + "\"");
        out.line(12, "elementFormDefault=\"qualified\">");
        out.blankLine();

        out.line(2, "<xsd:element name=\"" + attr(document.rootName()) + "\">");
        out.line(4, "<xsd:complexType>");
        out.line(6, "<xsd:sequence>");
        for (GridRow row : document.gridData()) {
            if (row == null || !row.hasName() || !row.hasType()) {
                continue;
            }
            final String minOccurs = row.minOccurs().isEmpty() ? DEFAULT_OCCURS : row.minOccurs();
            final String maxOccurs = row.maxOccurs().isEmpty() ? DEFAULT_OCCURS : row.maxOccurs();
            final String type = row.type().startsWith(XSD_PREFIX) ? row.type() : XSD_PREFIX + row.type();
            out.line(8, "<xsd:element name=\"" + attr(row.name()) + "\" type=\"" + attr(type)
                    + "\" minOccurs=\"" + attr(minOccurs) + "\" maxOccurs=\"" + attr(maxOccurs) + "\" />");
        }
        out.line(6, "</xsd:sequence>");
        out.line(4, "</xsd:complexType>");
        out.line(2, "</xsd:element>");
        out.blankLine();
        out.last("</xsd:schema>");

        return reporter.generated(out.toString());
    }

    /**
     * Recovers root name, target namespace and the first sequence's elements
     * through three independent pattern passes. A missing root element or
     * target namespace fails the parse; a missing sequence yields no rows.
     */
    @Override
    public ParseResult parseInput(String input) {
        if (input == null) {
            return reporter.parsed(ParseResult.failure("Failed to parse XSD: no input provided."));
        }
        if (input.isEmpty()) {
            return reporter.parsed(ParseResult.empty());
        }

        try {
            final String rootName = XmlExtraction.firstGroup(ROOT_ELEMENT, input)
                    .map(XmlExtraction::unescape)
                    .orElseThrow(() -> new XsdParseException("Could not find root <xsd:element> name."));
            final String targetNamespace = XmlExtraction.firstGroup(TARGET_NAMESPACE, input)
                    .map(XmlExtraction::unescape)
                    .orElseThrow(() -> new XsdParseException("Could not find targetNamespace."));

            final List<GridRow> rows = new ArrayList<>();
            XmlExtraction.firstGroup(SEQUENCE, input).ifPresent(sequence -> {
                for (MatchResult element : XmlExtraction.allMatches(SEQUENCE_ELEMENT, sequence)) {
                    final String rest = element.group(3);
                    rows.add(GridRow.builder()
                            .id(rows.size())
                            .name(XmlExtraction.unescape(element.group(1)))
                            .type(stripPrefix(XmlExtraction.unescape(element.group(2))))
                            .minOccurs(XmlExtraction.attribute(rest, "minOccurs").orElse(""))
                            .maxOccurs(XmlExtraction.attribute(rest, "maxOccurs").orElse(""))
                            .build());
                }
            });

            return reporter.parsed(new ParseResult(rootName, targetNamespace, rows, version(), null));
        }
        catch (XsdParseException e) {
            reporter.error("XSD parse failed", e);
            return reporter.parsed(ParseResult.failure("Failed to parse XSD: " + e.getMessage()));
        }
    }

    private static String stripPrefix(String type) {
        return type.replaceFirst(Pattern.quote(XSD_PREFIX), "");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Signals that a required schema shape was not found in the input.
     */
    private static final class XsdParseException extends RuntimeException
    {
        XsdParseException(String message) {
            super(message);
        }
    }
}
