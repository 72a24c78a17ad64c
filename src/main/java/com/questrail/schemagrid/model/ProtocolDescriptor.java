package com.questrail.schemagrid.model;

import java.util.List;
import java.util.Objects;

/**
 * Identity metadata a protocol exposes: canonical name, format version and
 * the order-stable list of capability tags callers branch on.
 */
public record ProtocolDescriptor(
        String name,
        String version,
        List<String> supportedFeatures
) {
    public ProtocolDescriptor {
        Objects.requireNonNull(name, "name");
        supportedFeatures = List.copyOf(supportedFeatures);
    }

    public boolean supports(String feature) {
        return supportedFeatures.contains(feature);
    }
}
