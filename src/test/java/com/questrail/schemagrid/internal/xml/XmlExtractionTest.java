package com.questrail.schemagrid.internal.xml;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class XmlExtractionTest
{
    private static final Pattern NAME = Pattern.compile("name=\"([^\"]*)\"");

    @Test
    void firstGroupFindsFirstMatchOnly() {
        assertEquals(Optional.of("a"), XmlExtraction.firstGroup(NAME, "<x name=\"a\"/><y name=\"b\"/>"));
        assertEquals(Optional.empty(), XmlExtraction.firstGroup(NAME, "<x/>"));
        assertEquals(Optional.empty(), XmlExtraction.firstGroup(NAME, null));
    }

    @Test
    void allMatchesInDocumentOrder() {
        List<MatchResult> matches = XmlExtraction.allMatches(NAME, "<x name=\"a\"/><y name=\"b\"/>");

        assertEquals(2, matches.size());
        assertEquals("a", matches.get(0).group(1));
        assertEquals("b", matches.get(1).group(1));
        assertTrue(XmlExtraction.allMatches(NAME, null).isEmpty());
    }

    /**
     * Verifies that attribute lookup accepts either quote style and does not
     * match an attribute whose name merely ends with the one requested.
     */
    @Test
    void attributeLookup() {
        String tag = " minOccurs='0' maxOccurs=\"unbounded\" xminOccurs=\"9\"/";

        assertEquals(Optional.of("0"), XmlExtraction.attribute(tag, "minOccurs"));
        assertEquals(Optional.of("unbounded"), XmlExtraction.attribute(tag, "maxOccurs"));
        assertEquals(Optional.empty(), XmlExtraction.attribute(tag, "nillable"));
        assertEquals(Optional.of("a&b"), XmlExtraction.attribute("v=\"a&amp;b\"", "v"));
    }

    @Test
    void unescapeReversesWriterEscaping() {
        String raw = "a & b <c> \"d\" 'e'";

        assertEquals(raw, XmlExtraction.unescape(XmlLineWriter.attr(raw)));
        assertEquals(raw, XmlExtraction.unescape(XmlLineWriter.text(raw)));
        assertEquals("&lt;", XmlExtraction.unescape("&amp;lt;"));
        assertNull(XmlExtraction.unescape(null));
    }

    @Test
    void withoutRemovesMatchedRegions() {
        assertEquals("<x/><y/>", XmlExtraction.without(Pattern.compile("\\s*name=\"[^\"]*\""), "<x name=\"a\"/><y name=\"b\"/>"));
    }
}
