package com.questrail.schemagrid.protocol;

import com.questrail.schemagrid.model.GridRow;

import java.util.List;
import java.util.Set;

/**
 * Type-token rules for WSDL grids.
 *
 * <p>A type token is valid if it is one of the built-in XSD primitives, is
 * prefixed {@code xsd:} or {@code tns:}, or is an unprefixed non-primitive
 * name. The last two forms are references to a complex type that must be
 * defined in the same grid by a row whose type is {@value #COMPLEX_TYPE}.</p>
 */
final class WsdlTypeSystem
{
    /** Type token marking a row as a complex-type definition. */
    static final String COMPLEX_TYPE = "complexType";

    static final Set<String> PRIMITIVES = Set.of(
            "string", "int", "integer", "boolean", "decimal", "float", "double",
            "dateTime", "date", "time", "hexBinary", "base64Binary", "anyURI",
            "QName", "normalizedString", "token", "language", "NMTOKEN", "Name",
            "NCName", "ID", "IDREF", "IDREFS", "ENTITY", "ENTITIES", "NOTATION"
    );

    private static final String XSD_PREFIX = "xsd:";
    private static final String TNS_PREFIX = "tns:";

    private WsdlTypeSystem() {}

    static boolean isValidType(String type) {
        if (type == null || type.isEmpty()) {
            return false;
        }
        return PRIMITIVES.contains(type)
                || type.startsWith(XSD_PREFIX)
                || type.startsWith(TNS_PREFIX)
                || isComplexTypeReference(type);
    }

    static boolean isComplexTypeReference(String type) {
        if (type == null || type.isEmpty()) {
            return false;
        }
        return type.startsWith(TNS_PREFIX)
                || (type.indexOf(':') < 0 && !PRIMITIVES.contains(type));
    }

    static boolean isComplexTypeDefinition(GridRow row) {
        return COMPLEX_TYPE.equals(row.type());
    }

    /**
     * Returns true if a row in {@code rows} defines the complex type that
     * {@code reference} points to.
     */
    static boolean complexTypeExists(String reference, List<GridRow> rows) {
        final String typeName = reference.startsWith(TNS_PREFIX)
                ? reference.substring(TNS_PREFIX.length())
                : reference;
        for (GridRow row : rows) {
            if (row != null && typeName.equals(row.name()) && isComplexTypeDefinition(row)) {
                return true;
            }
        }
        return false;
    }
}
