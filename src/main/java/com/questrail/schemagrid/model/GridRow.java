package com.questrail.schemagrid.model;

/**
 * GridRow
 * -----------------------------------------------------------------------------
 * One row of the tabular ("grid") schema model.
 *
 * <p>The grid is the format-independent intermediate representation every
 * protocol reads from and writes to. A row describes a single field:</p>
 * <ul>
 *   <li>{@code structure} optionally names the complex type this row belongs to
 *       (empty means top level)</li>
 *   <li>{@code name} and {@code type} identify the field and its type token</li>
 *   <li>{@code minOccurs} / {@code maxOccurs} carry cardinality as text, because
 *       {@code "unbounded"} is a legal value</li>
 * </ul>
 *
 * <p>Null string components are normalised to {@code ""} so protocol code can
 * test emptiness without null checks. Cross-field consistency (type without
 * name, name without type) is format-dependent and is checked by each
 * protocol's validation, not here.</p>
 */
public record GridRow(
        int id,
        String structure,
        String field,
        String name,
        String type,
        String minOccurs,
        String maxOccurs
) {
    public GridRow {
        structure = normalise(structure);
        field = normalise(field);
        name = normalise(name);
        type = normalise(type);
        minOccurs = normalise(minOccurs);
        maxOccurs = normalise(maxOccurs);
    }

    /**
     * Creates a top-level row with only a name and a type.
     */
    public static GridRow of(String name, String type) {
        return builder().name(name).type(type).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns true if this row carries no name, type, field or structure and is
     * therefore ignored by generation.
     */
    public boolean isEmpty() {
        return name.isEmpty() && type.isEmpty() && field.isEmpty() && structure.isEmpty();
    }

    public boolean hasName() {
        return !name.isEmpty();
    }

    public boolean hasType() {
        return !type.isEmpty();
    }

    public boolean isTopLevel() {
        return structure.isEmpty();
    }

    private static String normalise(String value) {
        return value == null ? "" : value;
    }

    public static final class Builder {
        private int id;
        private String structure = "";
        private String field = "";
        private String name = "";
        private String type = "";
        private String minOccurs = "";
        private String maxOccurs = "";

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder structure(String structure) {
            this.structure = structure;
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder minOccurs(String minOccurs) {
            this.minOccurs = minOccurs;
            return this;
        }

        public Builder maxOccurs(String maxOccurs) {
            this.maxOccurs = maxOccurs;
            return this;
        }

        public Builder occurs(String minOccurs, String maxOccurs) {
            this.minOccurs = minOccurs;
            this.maxOccurs = maxOccurs;
            return this;
        }

        public GridRow build() {
            return new GridRow(id, structure, field, name, type, minOccurs, maxOccurs);
        }
    }
}
