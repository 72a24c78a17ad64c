package com.questrail.schemagrid.internal.xml;

/**
 * XmlLineWriter
 * -----------------------------------------------------------------------------
 * Line-oriented assembler for the XML text the protocols generate.
 *
 * <p>Generated documents are compared by literal substring (attribute order,
 * spacing and omitted default attributes all matter), so output is assembled
 * line by line rather than through a DOM serializer, whose formatting is not
 * under our control.</p>
 *
 * <p>Indentation is expressed in spaces. Values interpolated into attributes or
 * text content must go through {@link #attr(String)} / {@link #text(String)}.</p>
 */
public final class XmlLineWriter
{
    public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private final StringBuilder out = new StringBuilder(1024);

    public XmlLineWriter declaration()
    {
        return line(0, DECLARATION);
    }

    /**
     * Appends {@code content} indented by {@code indent} spaces, followed by a newline.
     */
    public XmlLineWriter line(int indent, String content)
    {
        out.append(" ".repeat(indent)).append(content).append('\n');
        return this;
    }

    public XmlLineWriter blankLine()
    {
        out.append('\n');
        return this;
    }

    /**
     * Appends {@code content} with no indentation and no trailing newline.
     * Used for the closing root tag.
     */
    public XmlLineWriter last(String content)
    {
        out.append(content);
        return this;
    }

    @Override
    public String toString()
    {
        return out.toString();
    }

    /**
     * Escapes a value for use inside a quoted attribute. Both quote
     * characters are escaped, so the value is safe in either quoting style.
     */
    public static String attr(String value)
    {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes a value for use as element text content.
     */
    public static String text(String value)
    {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
