package com.questrail.schemagrid.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of recovering a grid from wire-format text.
 *
 * <p>Parsing never throws. A failed parse still returns a usable value: the
 * best-effort partial result (empty strings and an empty grid when nothing was
 * recognised) plus a non-null {@code error} describing the failure. This lets
 * callers render a "nothing recognised" state without extra null checks.</p>
 *
 * <p>{@code version} carries the format version detected in the input, when
 * the format has one (WSDL), and is null otherwise.</p>
 */
public record ParseResult(
        String rootName,
        String targetNamespace,
        List<GridRow> gridData,
        String version,
        String error
) {
    public ParseResult {
        rootName = (rootName == null) ? "" : rootName;
        targetNamespace = (targetNamespace == null) ? "" : targetNamespace;
        gridData = (gridData == null) ? List.of() : List.copyOf(gridData);
    }

    public static ParseResult empty() {
        return new ParseResult("", "", List.of(), null, null);
    }

    public static ParseResult failure(String error) {
        return new ParseResult("", "", List.of(), null, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public ParseResult withError(String error) {
        return new ParseResult(rootName, targetNamespace, gridData, version, error);
    }
}
