/**
 * Protocol Layer
 * =============================================================================
 *
 * <p>This package holds the converters between the grid model and each
 * supported wire format:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.schemagrid.protocol.WsdlProtocol} (WSDL 1.1 and 2.0)</li>
 *   <li>{@link com.questrail.schemagrid.protocol.XsdProtocol}</li>
 *   <li>{@link com.questrail.schemagrid.protocol.JsonRpcProtocol}</li>
 *   <li>{@link com.questrail.schemagrid.protocol.SapIdocProtocol} (generation only)</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   List&lt;GridRow&gt;
 *        → SchemaDocument
 *            → GridProtocol.validateStructure / generateOutput
 *                → wire text
 *                    → GridProtocol.parseInput
 *                        → ParseResult
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Protocols never throw from the contract operations; failures are
 *       returned as validation errors, embedded error text or
 *       {@link com.questrail.schemagrid.model.ParseResult#error()}.</li>
 *   <li>Parsing is pattern-based. It recognises the shapes the generators
 *       emit and common hand-written variants; it is not a general XML or
 *       WSDL processor.</li>
 *   <li>Instances are immutable and keep no per-call state.</li>
 * </ul>
 */
package com.questrail.schemagrid.protocol;
