package com.questrail.schemagrid.protocol;

import java.util.Optional;

/**
 * WSDL document versions the generator can emit.
 *
 * <p>The two versions differ in root element, namespace and section names:</p>
 * <ul>
 *   <li>1.1: {@code <definitions>}, {@code <message>}/{@code <portType>}, SOAP 1.1 binding</li>
 *   <li>2.0: {@code <description>}, {@code <interface>}, {@code wsoap:} binding</li>
 * </ul>
 */
public enum WsdlVersion
{
    V1_1("1.1", "http://schemas.xmlsoap.org/wsdl/"),
    V2_0("2.0", "http://www.w3.org/ns/wsdl");

    private final String label;
    private final String namespace;

    WsdlVersion(String label, String namespace) {
        this.label = label;
        this.namespace = namespace;
    }

    public String label() {
        return label;
    }

    /**
     * Default namespace URI of the version's root element.
     */
    public String namespace() {
        return namespace;
    }

    /**
     * The literal default-namespace declaration that identifies a document of
     * this version.
     */
    String namespaceDeclaration() {
        return "xmlns=\"" + namespace + "\"";
    }

    public static Optional<WsdlVersion> fromLabel(String label) {
        for (WsdlVersion v : values()) {
            if (v.label.equals(label)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Infers the version from a document's default namespace declaration.
     */
    static Optional<WsdlVersion> detect(String content) {
        if (content.contains(V1_1.namespaceDeclaration())) {
            return Optional.of(V1_1);
        }
        if (content.contains(V2_0.namespaceDeclaration())) {
            return Optional.of(V2_0);
        }
        return Optional.empty();
    }
}
