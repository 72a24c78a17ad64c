package com.questrail.schemagrid.protocol;

import com.questrail.schemagrid.config.IdocControlDefaults;
import com.questrail.schemagrid.config.ProtocolConfig;
import com.questrail.schemagrid.internal.xml.XmlLineWriter;
import com.questrail.schemagrid.model.GridRow;
import com.questrail.schemagrid.model.ParseResult;
import com.questrail.schemagrid.model.SchemaDocument;
import com.questrail.schemagrid.model.ValidationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * SapIdocProtocol
 * -----------------------------------------------------------------------------
 * Generator for SAP IDoc XML.
 *
 * <p>The document's root name is the IDoc type (e.g. {@code ORDERS05}). The
 * output holds an {@code EDI_DC40} control record followed by a single data
 * segment named {@code E1} plus the IDoc type without its two-character
 * version suffix ({@code ORDERS05 -> E1ORDERS}). Each named row becomes an
 * upper-cased field tag whose text is the row's type token, used as a sample
 * value.</p>
 *
 * <p>Only generation is supported. {@link #parseInput} always reports that
 * IDoc parsing is not implemented.</p>
 */
public final class SapIdocProtocol implements GridProtocol
{
    public static final String PROTOCOL_NAME = "SAP";

    static final String PARSE_NOT_IMPLEMENTED = "SAP IDoc parsing is not yet implemented.";

    private static final List<String> FEATURES = List.of("IDocXMLGeneration");

    private static final String CONTROL_SEGMENT = "EDI_DC40";
    private static final String UNKNOWN_MESSAGE_TYPE = "MESTYP_UNKNOWN";

    private final IdocControlDefaults control;
    private final OperationReporter reporter;

    public SapIdocProtocol() {
        this(ProtocolConfig.defaults());
    }

    public SapIdocProtocol(ProtocolConfig config) {
        Objects.requireNonNull(config, "config");
        this.control = config.idocControl();
        this.reporter = new OperationReporter(PROTOCOL_NAME, config.observabilitySink());
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.SAP;
    }

    @Override
    public String getProtocolName() {
        return PROTOCOL_NAME;
    }

    /**
     * IDoc XML carries its record layout in the control segment name rather
     * than a document version.
     */
    @Override
    public String version() {
        return null;
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
        if (document.rootName() == null || document.rootName().isBlank()) {
            return reporter.validated(ValidationResult.invalid(
                    "IDoc Type (e.g., ORDERS05) is required in the Root Name field."));
        }
        return reporter.validated(ValidationResult.valid());
    }

    @Override
    public String generateOutput(SchemaDocument document) {
        final ValidationResult validation = validateStructure(document);
        if (!validation.isValid()) {
            return reporter.generatedFallback(
                    "Error generating IDoc: " + validation.joinedErrors(), validation.errors());
        }

        final String idocType = document.rootName();
        final String segment = dataSegmentName(idocType);

        final XmlLineWriter out = new XmlLineWriter().declaration();
        out.line(0, "<" + idocType + ">");
        out.line(2, "<IDOC BEGIN=\"1\">");

        out.line(4, "<" + CONTROL_SEGMENT + " SEGMENT=\"1\">");
        for (Map.Entry<String, String> field : controlRecord(document).entrySet()) {
            out.line(6, "<" + field.getKey() + ">" + XmlLineWriter.text(field.getValue()) + "</" + field.getKey() + ">");
        }
        out.line(4, "</" + CONTROL_SEGMENT + ">");

        out.line(4, "<" + segment + " SEGMENT=\"1\">");
        for (GridRow row : document.gridData()) {
            if (row != null && row.hasName()) {
                final String tag = row.name().toUpperCase(Locale.ROOT);
                out.line(6, "<" + tag + ">" + XmlLineWriter.text(row.type()) + "</" + tag + ">");
            }
        }
        out.line(4, "</" + segment + ">");

        out.line(2, "</IDOC>");
        out.last("</" + idocType + ">");

        return reporter.generated(out.toString());
    }

    @Override
    public ParseResult parseInput(String input) {
        return reporter.parsed(ParseResult.failure(PARSE_NOT_IMPLEMENTED));
    }

    /**
     * {@code ORDERS05 -> E1ORDERS}; types shorter than two characters yield {@code E1}.
     */
    static String dataSegmentName(String idocType) {
        return "E1" + idocType.substring(0, Math.max(0, idocType.length() - 2));
    }

    private Map<String, String> controlRecord(SchemaDocument document) {
        final String messageType = document.messageType();
        final Map<String, String> fields = new LinkedHashMap<>();
        fields.put("TABNAM", CONTROL_SEGMENT);
        fields.put("IDOCTYP", document.rootName());
        fields.put("MESTYP", (messageType == null || messageType.isEmpty()) ? UNKNOWN_MESSAGE_TYPE : messageType);
        fields.put("SNDPOR", control.senderPort());
        fields.put("SNDPRT", control.senderPartnerType());
        fields.put("SNDPRN", control.senderPartner());
        fields.put("RCVPOR", control.receiverPort());
        fields.put("RCVPRT", control.receiverPartnerType());
        fields.put("RCVPRN", control.receiverPartner());
        return fields;
    }
}
