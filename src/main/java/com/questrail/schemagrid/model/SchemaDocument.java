package com.questrail.schemagrid.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Caller-level unit handed to a protocol for validation or generation.
 *
 * <p>The engine never stores a {@code SchemaDocument}; it is created per call.
 * {@code rootName} and {@code targetNamespace} may be null or blank: reporting
 * that is the job of validation, so construction never rejects them. A null
 * {@code gridData} is treated as "no rows". {@code messageType} is optional
 * and only meaningful to formats that carry one (SAP IDoc).</p>
 */
public record SchemaDocument(
        String rootName,
        String targetNamespace,
        String xmlNamespace,
        List<GridRow> gridData,
        String messageType
) {
    public SchemaDocument {
        gridData = (gridData == null)
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(gridData));
    }

    public static SchemaDocument of(String rootName, String targetNamespace, List<GridRow> gridData) {
        return new SchemaDocument(rootName, targetNamespace, null, gridData, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rows that carry at least one of name, type, field or structure.
     */
    public List<GridRow> filledRows() {
        List<GridRow> filled = new ArrayList<>();
        for (GridRow row : gridData) {
            if (row != null && !row.isEmpty()) {
                filled.add(row);
            }
        }
        return filled;
    }

    public static final class Builder {
        private String rootName;
        private String targetNamespace;
        private String xmlNamespace;
        private final List<GridRow> gridData = new ArrayList<>();
        private String messageType;

        public Builder rootName(String rootName) {
            this.rootName = rootName;
            return this;
        }

        public Builder targetNamespace(String targetNamespace) {
            this.targetNamespace = targetNamespace;
            return this;
        }

        public Builder xmlNamespace(String xmlNamespace) {
            this.xmlNamespace = xmlNamespace;
            return this;
        }

        public Builder messageType(String messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder addRow(GridRow row) {
            gridData.add(Objects.requireNonNull(row, "row"));
            return this;
        }

        public Builder rows(List<GridRow> rows) {
            gridData.clear();
            rows.forEach(this::addRow);
            return this;
        }

        public SchemaDocument build() {
            return new SchemaDocument(rootName, targetNamespace, xmlNamespace, gridData, messageType);
        }
    }
}
