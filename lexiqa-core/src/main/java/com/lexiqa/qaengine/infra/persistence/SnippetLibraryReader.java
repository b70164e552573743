package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.exceptions.DocumentParseException;
import com.lexiqa.qaengine.api.model.SnippetCategory;
import com.lexiqa.qaengine.api.model.SnippetEntry;
import com.lexiqa.qaengine.api.model.SnippetLibrary;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * Streaming reader for snippet library documents.
 *
 * <p>An entry belongs to its nearest enclosing {@code category}; categories may nest,
 * and every named category appears once in the result, in the order its start tag was
 * read. Entries outside any category, and entries whose nearest category has no
 * {@code name} attribute, are collected into an {@value SnippetLibrary#UNCATEGORIZED}
 * category appended after the named ones. Entries without an {@code id} attribute get
 * a random UUID. Unknown elements are skipped with their content.
 */
public final class SnippetLibraryReader {

    static final String ROOT = "regex-library";

    private final XMLInputFactory factory = XmlText.newInputFactory();

    public SnippetLibrary read(InputStream in, String documentName) throws DocumentParseException {
        XMLStreamReader reader = null;
        try {
            reader = factory.createXMLStreamReader(in);
            return new ParseState(documentName).run(reader);
        } catch (XMLStreamException e) {
            Location location = e.getLocation();
            throw new DocumentParseException(documentName, e.getMessage(),
                    location == null ? -1 : location.getLineNumber(),
                    location == null ? -1 : location.getColumnNumber(), e);
        } finally {
            ProfileDocumentReader.closeQuietly(reader);
        }
    }

    enum Element {
        LIBRARY,
        CATEGORY,
        ENTRY,
        NAME,
        DESCRIPTION,
        PATTERN,
        REPLACE,
        UNKNOWN;

        static Element of(String localName) {
            return switch (localName) {
                case SnippetLibraryReader.ROOT -> LIBRARY;
                case "category" -> CATEGORY;
                case "entry" -> ENTRY;
                case "name" -> NAME;
                case "description" -> DESCRIPTION;
                case "pattern" -> PATTERN;
                case "replace" -> REPLACE;
                default -> UNKNOWN;
            };
        }
    }

    /**
     * A {@code category} element that is open at the current position.
     */
    private static final class OpenCategory {
        final String name;
        final int depth;
        final List<SnippetEntry> entries = new ArrayList<>();

        OpenCategory(String name, int depth) {
            this.name = name;
            this.depth = depth;
        }
    }

    private static final class ParseState {
        private final String documentName;
        private final List<OpenCategory> named = new ArrayList<>();
        private final Deque<OpenCategory> open = new ArrayDeque<>();
        private final List<SnippetEntry> orphans = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private boolean inEntry;
        private Element field;
        private int depth;
        private int fieldDepth;
        private int skipDepth;

        private String id;
        private String name;
        private String description;
        private String pattern;
        private String replacement;

        ParseState(String documentName) {
            this.documentName = documentName;
        }

        SnippetLibrary run(XMLStreamReader reader) throws XMLStreamException, DocumentParseException {
            boolean sawRoot = false;
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        depth++;
                        Element element = Element.of(reader.getLocalName());
                        if (depth == 1) {
                            if (element != Element.LIBRARY) {
                                Location location = reader.getLocation();
                                throw new DocumentParseException(documentName,
                                        "Expected root element <" + SnippetLibraryReader.ROOT + "> but found <"
                                                + reader.getLocalName() + ">",
                                        location.getLineNumber(), location.getColumnNumber());
                            }
                            sawRoot = true;
                        } else if (field == null && skipDepth == 0) {
                            startElement(reader, element);
                        }
                    }
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                        if (field != null) {
                            text.append(reader.getText());
                        }
                    }
                    case XMLStreamConstants.END_ELEMENT -> {
                        if (field != null && depth == fieldDepth) {
                            assign(field, text.toString());
                            field = null;
                        } else if (skipDepth == depth) {
                            skipDepth = 0;
                        } else if (field == null && skipDepth == 0) {
                            endElement(Element.of(reader.getLocalName()));
                        }
                        depth--;
                    }
                    default -> {
                        // comments, processing instructions
                    }
                }
            }
            if (!sawRoot) {
                throw new DocumentParseException(documentName,
                        "Document has no <" + SnippetLibraryReader.ROOT + "> element");
            }
            List<SnippetCategory> categories = new ArrayList<>(named.size() + 1);
            for (OpenCategory category : named) {
                categories.add(new SnippetCategory(category.name, category.entries));
            }
            if (!orphans.isEmpty()) {
                categories.add(new SnippetCategory(SnippetLibrary.UNCATEGORIZED, orphans));
            }
            return new SnippetLibrary(categories);
        }

        private void startElement(XMLStreamReader reader, Element element) {
            switch (element) {
                case CATEGORY -> {
                    if (inEntry) {
                        skipDepth = depth;
                        return;
                    }
                    String value = reader.getAttributeValue(null, "name");
                    OpenCategory category = new OpenCategory(value == null || value.isEmpty() ? null : value, depth);
                    if (category.name != null) {
                        named.add(category);
                    }
                    open.push(category);
                }
                case ENTRY -> {
                    if (inEntry) {
                        skipDepth = depth;
                        return;
                    }
                    inEntry = true;
                    String value = reader.getAttributeValue(null, "id");
                    id = value == null || value.isEmpty() ? UUID.randomUUID().toString() : value;
                    name = null;
                    description = null;
                    pattern = null;
                    replacement = null;
                }
                case NAME, DESCRIPTION, PATTERN, REPLACE -> {
                    if (inEntry) {
                        field = element;
                        fieldDepth = depth;
                        text.setLength(0);
                    } else {
                        skipDepth = depth;
                    }
                }
                default -> skipDepth = depth;
            }
        }

        private void endElement(Element element) {
            switch (element) {
                case ENTRY -> {
                    inEntry = false;
                    OpenCategory category = open.peek();
                    if (category != null && category.name != null) {
                        category.entries.add(new SnippetEntry(id, name, description, pattern, replacement,
                                category.name));
                    } else {
                        orphans.add(new SnippetEntry(id, name, description, pattern, replacement,
                                SnippetLibrary.UNCATEGORIZED));
                    }
                }
                case CATEGORY -> {
                    if (!open.isEmpty() && open.peek().depth == depth) {
                        open.pop();
                    }
                }
                default -> {
                    // fields are closed in run()
                }
            }
        }

        private void assign(Element element, String value) {
            switch (element) {
                case NAME -> name = value;
                case DESCRIPTION -> description = value;
                case PATTERN -> pattern = value;
                case REPLACE -> replacement = value;
                default -> {
                    // not a field
                }
            }
        }
    }
}
