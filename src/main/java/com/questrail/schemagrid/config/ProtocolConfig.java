package com.questrail.schemagrid.config;

import com.questrail.schemagrid.observability.ConversionObservabilitySink;
import com.questrail.schemagrid.observability.Slf4jConversionObservabilitySink;

import java.util.Objects;

/**
 * Aggregated construction-time configuration for a protocol instance.
 *
 * <p>Every protocol reads only the settings that concern it and ignores the
 * rest. A null {@code version} means "use the protocol's default version".
 * Configuration is captured once at construction; protocol instances never
 * change it afterwards.</p>
 */
public record ProtocolConfig(
    String version,
    String serviceAddressBase,
    IdocControlDefaults idocControl,
    ConversionObservabilitySink observabilitySink
) {
    /** Base URL for generated WSDL service endpoint addresses. */
    public static final String DEFAULT_SERVICE_ADDRESS_BASE = "http://example.com/";

    public ProtocolConfig {
        Objects.requireNonNull(serviceAddressBase, "serviceAddressBase");
        Objects.requireNonNull(idocControl, "idocControl");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static ProtocolConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String version;
        private String serviceAddressBase = DEFAULT_SERVICE_ADDRESS_BASE;
        private IdocControlDefaults idocControl = IdocControlDefaults.defaults();
        private ConversionObservabilitySink observabilitySink = new Slf4jConversionObservabilitySink();

        public Builder withVersion(String version) {
            this.version = version;
            return this;
        }

        public Builder withServiceAddressBase(String serviceAddressBase) {
            this.serviceAddressBase = serviceAddressBase;
            return this;
        }

        public Builder withIdocControl(IdocControlDefaults idocControl) {
            this.idocControl = idocControl;
            return this;
        }

        public Builder withObservabilitySink(ConversionObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public ProtocolConfig build() {
            return new ProtocolConfig(version, serviceAddressBase, idocControl, observabilitySink);
        }
    }
}
