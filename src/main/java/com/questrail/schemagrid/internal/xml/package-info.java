/**
 * Text-level XML helpers shared by the XML-flavoured protocols. Not part of
 * the public API.
 */
package com.questrail.schemagrid.internal.xml;
