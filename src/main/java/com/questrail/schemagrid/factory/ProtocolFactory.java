package com.questrail.schemagrid.factory;

import com.questrail.schemagrid.config.ProtocolConfig;
import com.questrail.schemagrid.protocol.GridProtocol;
import com.questrail.schemagrid.protocol.JsonRpcProtocol;
import com.questrail.schemagrid.protocol.ProtocolKind;
import com.questrail.schemagrid.protocol.SapIdocProtocol;
import com.questrail.schemagrid.protocol.WsdlProtocol;
import com.questrail.schemagrid.protocol.XsdProtocol;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * ProtocolFactory
 * -----------------------------------------------------------------------------
 * Centralized construction point for {@link GridProtocol} instances.
 *
 * <p>Format names are resolved case-insensitively against the
 * {@link ProtocolKind} registry. The registry includes formats that are known
 * but not implemented yet; those are reported as supported by
 * {@link #isProtocolSupported(String)} but cannot be created.</p>
 */
public final class ProtocolFactory
{
    private static final List<String> SUPPORTED = Arrays.stream(ProtocolKind.values())
            .map(ProtocolKind::key)
            .toList();

    private ProtocolFactory() {}

    /**
     * Creates a protocol with default configuration.
     *
     * @see #createProtocol(String, ProtocolConfig)
     */
    public static GridProtocol createProtocol(String protocolType)
    {
        return createProtocol(protocolType, ProtocolConfig.defaults());
    }

    /**
     * Creates a protocol for a case-insensitive format name.
     *
     * @param protocolType format name such as {@code "wsdl"} or {@code "XSD"}
     * @param config       construction-time configuration; null means defaults
     * @return a new, immutable protocol instance
     * @throws NullPointerException         if {@code protocolType} is null
     * @throws UnsupportedProtocolException if the format is unknown or not implemented yet
     */
    public static GridProtocol createProtocol(String protocolType, ProtocolConfig config)
    {
        Objects.requireNonNull(protocolType, "protocolType");
        final ProtocolConfig effective = (config == null) ? ProtocolConfig.defaults() : config;

        final ProtocolKind kind = ProtocolKind.fromKey(protocolType)
                .orElseThrow(() -> UnsupportedProtocolException.unknown(protocolType));

        return switch (kind) {
            case WSDL -> new WsdlProtocol(effective);
            case JSONRPC -> new JsonRpcProtocol(effective);
            case XSD -> new XsdProtocol(effective);
            case SAP -> new SapIdocProtocol(effective);
            case SOAP -> throw UnsupportedProtocolException.notImplemented(kind);
        };
    }

    /**
     * Returns every registered format key, including not-yet-implemented ones,
     * in registry order.
     */
    public static List<String> getSupportedProtocols()
    {
        return SUPPORTED;
    }

    /**
     * Returns true for any registered key regardless of case; false for null,
     * empty or unknown names. Never throws.
     */
    public static boolean isProtocolSupported(String protocolType)
    {
        return ProtocolKind.fromKey(protocolType).isPresent();
    }
}
