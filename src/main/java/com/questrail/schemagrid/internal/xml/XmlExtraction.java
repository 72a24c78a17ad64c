package com.questrail.schemagrid.internal.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based extraction helpers for the XML-flavoured parsers.
 *
 * <p>These are deliberately not an XML parser: they find well-known tag and
 * attribute shapes in text and never throw on malformed input. A shape that
 * is not found is reported as {@link Optional#empty()} or an empty list.</p>
 */
public final class XmlExtraction
{
    private XmlExtraction() {}

    /**
     * Returns group 1 of the first match of {@code pattern}, if any.
     */
    public static Optional<String> firstGroup(Pattern pattern, CharSequence input)
    {
        if (input == null) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(input);
        return m.find() ? Optional.ofNullable(m.group(1)) : Optional.empty();
    }

    /**
     * Returns every match of {@code pattern} in document order.
     */
    public static List<MatchResult> allMatches(Pattern pattern, CharSequence input)
    {
        List<MatchResult> results = new ArrayList<>();
        if (input == null) {
            return results;
        }
        Matcher m = pattern.matcher(input);
        while (m.find()) {
            results.add(m.toMatchResult());
        }
        return results;
    }

    /**
     * Reads a single- or double-quoted attribute from the text of one tag.
     */
    public static Optional<String> attribute(String tag, String attributeName)
    {
        Pattern p = Pattern.compile("\\b" + Pattern.quote(attributeName) + "\\s*=\\s*[\"']([^\"']*)[\"']");
        return firstGroup(p, tag).map(XmlExtraction::unescape);
    }

    /**
     * Reverses the escaping applied by {@link XmlLineWriter}.
     */
    public static String unescape(String value)
    {
        if (value == null || value.indexOf('&') < 0) {
            return value;
        }
        return value.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    /**
     * Removes every region matched by {@code pattern} from {@code input}.
     */
    public static String without(Pattern pattern, String input)
    {
        return pattern.matcher(input).replaceAll("");
    }
}
