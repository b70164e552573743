package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.model.SnippetCategory;
import com.lexiqa.qaengine.api.model.SnippetEntry;
import com.lexiqa.qaengine.api.model.SnippetLibrary;

/**
 * Writes libraries in the layout read by {@link SnippetLibraryReader}. Entry ids are always written.
 * A library holding a character XML cannot represent is rejected before anything is written.
 */
public final class SnippetLibraryWriter {

    public String toXml(SnippetLibrary library) {
        validate(library);
        StringBuilder xml = new StringBuilder(256 + library.size() * 192);
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append('<').append(SnippetLibraryReader.ROOT).append(">\n");
        for (SnippetCategory category : library.categories()) {
            xml.append("  <category name=\"").append(XmlText.escapeAttribute(category.name())).append('"');
            if (category.entries().isEmpty()) {
                xml.append("/>\n");
                continue;
            }
            xml.append(">\n");
            for (SnippetEntry entry : category.entries()) {
                xml.append("    <entry id=\"").append(XmlText.escapeAttribute(entry.id())).append("\">\n");
                element(xml, "name", entry.name());
                element(xml, "description", entry.description());
                element(xml, "pattern", entry.pattern());
                element(xml, "replace", entry.replacement());
                xml.append("    </entry>\n");
            }
            xml.append("  </category>\n");
        }
        xml.append("</").append(SnippetLibraryReader.ROOT).append(">\n");
        return xml.toString();
    }

    /**
     * @throws IllegalArgumentException if a category or entry field holds a character XML cannot represent
     */
    static void validate(SnippetLibrary library) {
        for (SnippetCategory category : library.categories()) {
            XmlText.requireRepresentable("Category name '" + category.name() + "'", category.name());
            for (SnippetEntry entry : category.entries()) {
                String where = "Snippet '" + entry.id() + "' field ";
                XmlText.requireRepresentable(where + "id", entry.id());
                XmlText.requireRepresentable(where + "name", entry.name());
                XmlText.requireRepresentable(where + "description", entry.description());
                XmlText.requireRepresentable(where + "pattern", entry.pattern());
                XmlText.requireRepresentable(where + "replace", entry.replacement());
            }
        }
    }

    private static void element(StringBuilder xml, String name, String value) {
        xml.append("      <").append(name);
        if (value.isEmpty()) {
            xml.append("/>\n");
        } else {
            xml.append('>').append(XmlText.escape(value)).append("</").append(name).append(">\n");
        }
    }
}
