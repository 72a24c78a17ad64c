package com.questrail.schemagrid.detect;

import com.questrail.schemagrid.protocol.ProtocolKind;

import java.util.Locale;
import java.util.Optional;

/**
 * ProtocolDetector
 * -----------------------------------------------------------------------------
 * Heuristics that guess the wire format of uploaded content.
 *
 * <p>These are substring checks, not parsers. They are evaluated in a fixed
 * order and the first match wins, so a SOAP envelope that happens to embed a
 * schema is still reported as SOAP. Callers should treat the answer as a
 * suggestion for which protocol to try, not a guarantee that parsing will
 * succeed.</p>
 */
public final class ProtocolDetector
{
    private ProtocolDetector() {}

    /**
     * Guesses the format from document content.
     *
     * @param content document text, may be null
     * @return the detected format, or empty if nothing matched
     */
    public static Optional<ProtocolKind> detectProtocol(String content)
    {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }

        if (isWsdl(content)) {
            return Optional.of(ProtocolKind.WSDL);
        }
        if (content.contains("<soap:Envelope") || content.contains("xmlns:soap=")) {
            return Optional.of(ProtocolKind.SOAP);
        }
        if (content.contains("\"jsonrpc\"")
                && (content.contains("\"method\"") || content.contains("\"result\""))) {
            return Optional.of(ProtocolKind.JSONRPC);
        }
        if (content.contains("<xs:schema") || content.contains("<xsd:schema")) {
            return Optional.of(ProtocolKind.XSD);
        }
        if (content.contains("RFC") || content.contains("IDOC") || content.contains("BAPI")) {
            return Optional.of(ProtocolKind.SAP);
        }
        return Optional.empty();
    }

    /**
     * Guesses the format from a file name's extension. A {@code .xml} file is
     * only reported as SOAP when its name mentions soap.
     *
     * @param filename file name or path, may be null
     * @return the detected format, or empty if the extension is not recognised
     */
    public static Optional<ProtocolKind> detectFromExtension(String filename)
    {
        if (filename == null || filename.isEmpty()) {
            return Optional.empty();
        }

        final String name = filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".wsdl")) {
            return Optional.of(ProtocolKind.WSDL);
        }
        if (name.endsWith(".xsd")) {
            return Optional.of(ProtocolKind.XSD);
        }
        if (name.endsWith(".json")) {
            return Optional.of(ProtocolKind.JSONRPC);
        }
        if (name.endsWith(".xml") && name.contains("soap")) {
            return Optional.of(ProtocolKind.SOAP);
        }
        if (name.endsWith(".rfc") || name.endsWith(".idoc")) {
            return Optional.of(ProtocolKind.SAP);
        }
        return Optional.empty();
    }

    // WSDL 1.1 <definitions> or WSDL 2.0 <description>, each with its own default namespace.
    private static boolean isWsdl(String content)
    {
        return (content.contains("<definitions") && content.contains("xmlns=\"http://schemas.xmlsoap.org/wsdl/\""))
                || (content.contains("<description") && content.contains("xmlns=\"http://www.w3.org/ns/wsdl\""));
    }
}
