package com.questrail.schemagrid.observability;

/**
 * The contract operation a {@link ConversionEvent} reports on.
 */
public enum ConversionOperation {
    VALIDATE,
    GENERATE,
    PARSE,
    SCHEMA_CHECK
}
