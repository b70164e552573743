/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.exceptions.DocumentParseException;
import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.InputStream;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Streaming reader for profile documents.
 *
 * <pre>{@code
 * <qa_profile>
 *   <metadata><name/><description/><language/><created/><modified/></metadata>
 *   <checks>
 *     <check order="1" enabled="true">
 *       <name/><description/><pattern/><replacement/><category/>
 *       <case_sensitive/><exclude_pattern/>
 *     </check>
 *   </checks>
 * </qa_profile>
 * }</pre>
 *
 * <p>The parse is a state machine over a closed set of {@link Element} kinds. The
 * current {@link Section} and element together select the {@link Field} that receives
 * the next text events. Unknown elements are skipped. Field text is taken verbatim,
 * without trimming, so that what {@link ProfileDocumentWriter} wrote is read back unchanged.
 *
 * <p>Missing optional fields take their defaults: {@code enabled=true}, {@code order=0},
 * {@code case_sensitive=false}, empty {@code exclude_pattern}, category {@code Custom}.
 * Timestamps are epoch seconds; {@code YYYY-MM-DD} dates are accepted as well.
 */
public final class ProfileDocumentReader {

    static final String ROOT = "qa_profile";

    private final XMLInputFactory factory = XmlText.newInputFactory();

    /**
     * Parses a profile document.
     *
     * @param in           document bytes, UTF-8 unless the prolog says otherwise
     * @param documentName name used in error messages
     * @throws DocumentParseException if the document is malformed or not a profile
     */
    public Profile read(InputStream in, String documentName) throws DocumentParseException {
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
            closeQuietly(reader);
        }
    }

    static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException ignored) {
            // the underlying stream is owned and closed by the caller
        }
    }

    enum Element {
        QA_PROFILE,
        METADATA,
        CHECKS,
        CHECK,
        NAME,
        DESCRIPTION,
        LANGUAGE,
        CREATED,
        MODIFIED,
        PATTERN,
        REPLACEMENT,
        CATEGORY,
        CASE_SENSITIVE,
        EXCLUDE_PATTERN,
        UNKNOWN;

        static Element of(String localName) {
            try {
                return valueOf(localName.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return UNKNOWN;
            }
        }
    }

    enum Section {
        DOCUMENT,
        METADATA,
        CHECKS,
        CHECK
    }

    enum Field {
        PROFILE_NAME(Section.METADATA, Element.NAME),
        PROFILE_DESCRIPTION(Section.METADATA, Element.DESCRIPTION),
        PROFILE_LANGUAGE(Section.METADATA, Element.LANGUAGE),
        PROFILE_CREATED(Section.METADATA, Element.CREATED),
        PROFILE_MODIFIED(Section.METADATA, Element.MODIFIED),
        RULE_NAME(Section.CHECK, Element.NAME),
        RULE_DESCRIPTION(Section.CHECK, Element.DESCRIPTION),
        RULE_PATTERN(Section.CHECK, Element.PATTERN),
        RULE_REPLACEMENT(Section.CHECK, Element.REPLACEMENT),
        RULE_CATEGORY(Section.CHECK, Element.CATEGORY),
        RULE_CASE_SENSITIVE(Section.CHECK, Element.CASE_SENSITIVE),
        RULE_EXCLUDE_PATTERN(Section.CHECK, Element.EXCLUDE_PATTERN);

        private final Section section;
        private final Element element;

        Field(Section section, Element element) {
            this.section = section;
            this.element = element;
        }

        static Field resolve(Section section, Element element) {
            for (Field field : values()) {
                if (field.section == section && field.element == element) {
                    return field;
                }
            }
            return null;
        }
    }

    /**
     * Mutable state of one parse.
     */
    private static final class ParseState {
        private final String documentName;
        private final List<PatternRule> rules = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private Section section = Section.DOCUMENT;
        private Field target;
        private int depth;
        private int targetDepth;
        private int skipDepth;

        private String name;
        private String description;
        private String language;
        private long created;
        private long modified;
        private PatternRule.Builder rule;

        ParseState(String documentName) {
            this.documentName = documentName;
        }

        Profile run(XMLStreamReader reader) throws XMLStreamException, DocumentParseException {
            boolean sawRoot = false;
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        depth++;
                        Element element = Element.of(reader.getLocalName());
                        if (depth == 1) {
                            if (element != Element.QA_PROFILE) {
                                throw error(reader, "Expected root element <" + ROOT + "> but found <"
                                        + reader.getLocalName() + ">");
                            }
                            sawRoot = true;
                        } else if (target == null && skipDepth == 0) {
                            startElement(reader, element);
                        }
                    }
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA,
                            XMLStreamConstants.SPACE, XMLStreamConstants.ENTITY_REFERENCE -> {
                        if (target != null) {
                            text.append(reader.getText());
                        }
                    }
                    case XMLStreamConstants.END_ELEMENT -> {
                        if (target != null && depth == targetDepth) {
                            assign(reader, target, text.toString());
                            target = null;
                        } else if (skipDepth == depth) {
                            skipDepth = 0;
                        } else if (target == null && skipDepth == 0) {
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
                throw new DocumentParseException(documentName, "Document has no <" + ROOT + "> element");
            }
            return new Profile(name, description, language, rules, created, modified);
        }

        private void startElement(XMLStreamReader reader, Element element) throws DocumentParseException {
            switch (element) {
                case METADATA -> enter(section == Section.DOCUMENT, Section.METADATA);
                case CHECKS -> enter(section == Section.DOCUMENT, Section.CHECKS);
                case CHECK -> {
                    enter(section == Section.CHECKS, Section.CHECK);
                    if (section == Section.CHECK) {
                        rule = PatternRule.builder()
                                .order(parseOrder(reader, reader.getAttributeValue(null, "order")))
                                .enabled(parseBoolean(reader.getAttributeValue(null, "enabled"), true));
                    }
                }
                default -> {
                    Field field = Field.resolve(section, element);
                    if (field != null) {
                        target = field;
                        targetDepth = depth;
                        text.setLength(0);
                    } else {
                        skipDepth = depth;
                    }
                }
            }
        }

        /**
         * Moves into {@code next} when the element is allowed here, otherwise skips its subtree.
         */
        private void enter(boolean allowed, Section next) {
            if (allowed) {
                section = next;
            } else {
                skipDepth = depth;
            }
        }

        private void endElement(Element element) {
            switch (element) {
                case METADATA -> {
                    if (section == Section.METADATA) {
                        section = Section.DOCUMENT;
                    }
                }
                case CHECKS -> {
                    if (section == Section.CHECKS) {
                        section = Section.DOCUMENT;
                    }
                }
                case CHECK -> {
                    if (section == Section.CHECK) {
                        rules.add(rule.build());
                        rule = null;
                        section = Section.CHECKS;
                    }
                }
                default -> {
                    // fields are closed in run()
                }
            }
        }

        private void assign(XMLStreamReader reader, Field field, String value) throws DocumentParseException {
            switch (field) {
                case PROFILE_NAME -> name = value;
                case PROFILE_DESCRIPTION -> description = value;
                case PROFILE_LANGUAGE -> language = value;
                case PROFILE_CREATED -> created = parseTimestamp(reader, value);
                case PROFILE_MODIFIED -> modified = parseTimestamp(reader, value);
                case RULE_NAME -> rule.name(value);
                case RULE_DESCRIPTION -> rule.description(value);
                case RULE_PATTERN -> rule.pattern(value);
                case RULE_REPLACEMENT -> rule.replacement(value);
                case RULE_CATEGORY -> rule.category(value);
                case RULE_CASE_SENSITIVE -> rule.caseSensitive(parseBoolean(value, false));
                case RULE_EXCLUDE_PATTERN -> rule.excludePattern(value);
            }
        }

        private int parseOrder(XMLStreamReader reader, String value) throws DocumentParseException {
            if (value == null || value.isBlank()) {
                return 0;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw error(reader, "Invalid order attribute '" + value + "'");
            }
        }

        private long parseTimestamp(XMLStreamReader reader, String value) throws DocumentParseException {
            String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                return 0L;
            }
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException notEpoch) {
                try {
                    return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
                } catch (DateTimeParseException notDate) {
                    throw error(reader, "Invalid timestamp '" + value + "'");
                }
            }
        }

        private static boolean parseBoolean(String value, boolean defaultValue) {
            if (value == null || value.isBlank()) {
                return defaultValue;
            }
            return "true".equalsIgnoreCase(value.trim());
        }

        private DocumentParseException error(XMLStreamReader reader, String message) {
            Location location = reader.getLocation();
            return new DocumentParseException(documentName, message,
                    location.getLineNumber(), location.getColumnNumber());
        }
    }
}
