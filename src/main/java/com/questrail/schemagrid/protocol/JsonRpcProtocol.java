package com.questrail.schemagrid.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.schemagrid.config.ProtocolConfig;
import com.questrail.schemagrid.model.GridRow;
import com.questrail.schemagrid.model.ParseResult;
import com.questrail.schemagrid.model.SchemaDocument;
import com.questrail.schemagrid.model.ValidationResult;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JsonRpcProtocol
 * -----------------------------------------------------------------------------
 * Converter between the grid and a sample JSON-RPC 2.0 request.
 *
 * <p>The document's root name is the RPC method. Each named row becomes a
 * member of a by-name {@code params} object whose value is the row's type
 * token; the output is a request template showing the expected parameter
 * shape, not an invocation with real values.</p>
 *
 * <p>A missing method does not throw: generation returns a JSON-RPC error
 * envelope with code {@value #INVALID_REQUEST}.</p>
 */
public final class JsonRpcProtocol implements GridProtocol
{
    public static final String PROTOCOL_NAME = "JSON-RPC";

    public static final String DEFAULT_VERSION = "2.0";

    /** JSON-RPC "Invalid Request" error code. */
    public static final int INVALID_REQUEST = -32600;

    static final String SYNTAX_ERROR = "Failed to parse input. Please ensure it is valid JSON.";
    static final String MISSING_METHOD = "Invalid JSON-RPC input: The \"method\" property is missing.";

    private static final List<String> FEATURES = List.of("Request", "Notification", "BatchProcessing");

    private static final String UNTYPED_PARAM = "any";

    // Text after the first JSON value is a syntax error, not ignored.
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private final String version;
    private final OperationReporter reporter;

    public JsonRpcProtocol() {
        this(ProtocolConfig.defaults());
    }

    public JsonRpcProtocol(ProtocolConfig config) {
        Objects.requireNonNull(config, "config");
        this.version = (config.version() == null) ? DEFAULT_VERSION : config.version();
        this.reporter = new OperationReporter(PROTOCOL_NAME, config.observabilitySink());
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.JSONRPC;
    }

    @Override
    public String getProtocolName() {
        return PROTOCOL_NAME;
    }

    @Override
    public String version() {
        return version;
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
        if (document.rootName() == null || document.rootName().isBlank()) {
            errors.add("Method name (Root Name) is required and must be a non-empty string.");
        }

        final List<GridRow> rows = document.gridData();
        for (int i = 0; i < rows.size(); i++) {
            final GridRow row = rows.get(i);
            if (row != null && row.name().isBlank() && !row.type().isBlank()) {
                errors.add("Row " + (i + 1) + ": Parameter name is required if a type is specified.");
            }
        }

        return reporter.validated(ValidationResult.of(errors));
    }

    @Override
    public String generateOutput(SchemaDocument document) {
        final String method = (document == null) ? null : document.rootName();

        if (method == null || method.isEmpty()) {
            final ObjectNode envelope = MAPPER.createObjectNode();
            envelope.put("jsonrpc", DEFAULT_VERSION);
            final ObjectNode error = envelope.putObject("error");
            error.put("code", INVALID_REQUEST);
            error.put("message", "Invalid Request: Method name (Root Name) is required.");
            envelope.putNull("id");
            return reporter.generatedFallback(write(envelope), List.of(error.get("message").asText()));
        }

        final ObjectNode request = MAPPER.createObjectNode();
        request.put("jsonrpc", DEFAULT_VERSION);
        request.put("method", method);
        final ObjectNode params = request.putObject("params");
        for (GridRow row : document.gridData()) {
            if (row != null && row.hasName()) {
                params.put(row.name(), row.hasType() ? row.type() : UNTYPED_PARAM);
            }
        }
        request.put("id", 1);

        return reporter.generated(write(request));
    }

    /**
     * Recovers the method and by-name parameters of a JSON-RPC request.
     *
     * <p>Only object-shaped {@code params} are read; positional (array) params
     * yield no rows. Parameter values that are strings are taken as the type
     * token; other values are stored as their JSON text.</p>
     */
    @Override
    public ParseResult parseInput(String input) {
        if (input == null) {
            return reporter.parsed(ParseResult.failure("No JSON-RPC input provided."));
        }
        if (input.isBlank()) {
            return reporter.parsed(ParseResult.empty());
        }

        try {
            final JsonNode payload = MAPPER.readTree(input);
            if (payload == null || !payload.isObject() || !hasMethod(payload)) {
                throw new InvalidRequestException(MISSING_METHOD);
            }

            final List<GridRow> rows = new ArrayList<>();
            final JsonNode params = payload.get("params");
            if (params != null && params.isObject()) {
                final Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
                while (fields.hasNext()) {
                    final Map.Entry<String, JsonNode> field = fields.next();
                    final JsonNode value = field.getValue();
                    rows.add(GridRow.builder()
                            .id(rows.size())
                            .name(field.getKey())
                            .type(value.isTextual() ? value.asText() : value.toString())
                            .build());
                }
            }

            return reporter.parsed(new ParseResult(payload.get("method").asText(), "", rows, version, null));
        }
        catch (JsonProcessingException e) {
            reporter.error("JSON-RPC input is not valid JSON", e);
            return reporter.parsed(ParseResult.failure(SYNTAX_ERROR));
        }
        catch (InvalidRequestException e) {
            reporter.error("JSON-RPC input is not a request", e);
            return reporter.parsed(ParseResult.failure(e.getMessage()));
        }
    }

    private static boolean hasMethod(JsonNode payload) {
        final JsonNode method = payload.get("method");
        if (method == null || method.isNull() || method.isMissingNode() || method.isContainerNode()) {
            return false;
        }
        if (method.isTextual()) {
            return !method.asText().isEmpty();
        }
        if (method.isBoolean()) {
            return method.asBoolean();
        }
        return !(method.isNumber() && method.asDouble() == 0.0);
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        }
        catch (JsonProcessingException e) {
            // Tree nodes built from strings and numbers always serialize.
            throw new IllegalStateException("Failed to serialize JSON-RPC payload", e);
        }
    }

    /**
     * Well-formed JSON that is not a usable JSON-RPC request.
     */
    private static final class InvalidRequestException extends RuntimeException
    {
        InvalidRequestException(String message) {
            super(message);
        }
    }
}
