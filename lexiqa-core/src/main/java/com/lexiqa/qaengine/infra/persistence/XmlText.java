package com.lexiqa.qaengine.infra.persistence;

import javax.xml.stream.XMLInputFactory;

/**
 * Escaping and parser setup shared by the profile and library documents.
 */
final class XmlText {

    private XmlText() {
    }

    /**
     * Escapes the five reserved markup characters. Carriage returns are written as a
     * character reference because parsers normalize literal ones away.
     */
    static String escape(String value) {
        return escape(value, false);
    }

    /**
     * Like {@link #escape(String)}, and also writes tabs and line feeds as character
     * references, since attribute value normalization turns literal ones into spaces.
     */
    static String escapeAttribute(String value) {
        return escape(value, true);
    }

    /**
     * Rejects a value containing a character XML 1.0 cannot represent, such as most
     * C0 control characters or an unpaired surrogate.
     *
     * @param field name of the field, used in the message
     * @throws IllegalArgumentException naming the field and the first offending character
     */
    static void requireRepresentable(String field, String value) {
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            if (!isXmlChar(cp)) {
                throw new IllegalArgumentException(String.format(
                        "%s contains U+%04X at index %d, which an XML document cannot hold", field, cp, i));
            }
            i += Character.charCount(cp);
        }
    }

    private static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }

    private static String escape(String value, boolean attribute) {
        StringBuilder out = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            String replacement = switch (c) {
                case '&' -> "&amp;";
                case '<' -> "&lt;";
                case '>' -> "&gt;";
                case '"' -> "&quot;";
                case '\'' -> "&apos;";
                case '\r' -> "&#13;";
                case '\n' -> attribute ? "&#10;" : null;
                case '\t' -> attribute ? "&#9;" : null;
                default -> null;
            };
            if (replacement != null) {
                if (out == null) {
                    out = new StringBuilder(value.length() + 16);
                    out.append(value, 0, i);
                }
                out.append(replacement);
            } else if (out != null) {
                out.append(c);
            }
        }
        return out == null ? value : out.toString();
    }

    /**
     * Reverses {@link #escape(String)} and {@link #escapeAttribute(String)} for text
     * recovered without a parser.
     */
    static String unescape(String value) {
        return value.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&#13;", "\r")
                .replace("&#10;", "\n")
                .replace("&#9;", "\t")
                .replace("&amp;", "&");
    }

    /**
     * A StAX factory with DTDs and external entities disabled and text coalesced.
     */
    static XMLInputFactory newInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }
}
