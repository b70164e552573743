/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes profiles in the layout read by {@link ProfileDocumentReader}.
 *
 * <p>Every field is emitted, defaults included, and values are written verbatim
 * apart from escaping. Reading the output back yields an equal profile. A profile
 * holding a character XML cannot represent is rejected with an
 * {@link IllegalArgumentException} naming the field, before any output is produced.
 */
public final class ProfileDocumentWriter {

    private static final String INDENT = "    ";

    public void write(Profile profile, Writer out) throws IOException {
        out.write(toXml(profile));
        out.flush();
    }

    public String toXml(Profile profile) {
        validate(profile);
        StringBuilder xml = new StringBuilder(512 + profile.rules().size() * 256);
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append('<').append(ProfileDocumentReader.ROOT).append(">\n");

        xml.append(INDENT).append("<metadata>\n");
        element(xml, 2, "name", profile.name());
        element(xml, 2, "description", profile.description());
        element(xml, 2, "language", profile.language());
        element(xml, 2, "created", Long.toString(profile.created()));
        element(xml, 2, "modified", Long.toString(profile.modified()));
        xml.append(INDENT).append("</metadata>\n");

        xml.append(INDENT).append("<checks>\n");
        for (PatternRule rule : profile.rules()) {
            xml.append(INDENT).append(INDENT)
                    .append("<check order=\"").append(rule.order())
                    .append("\" enabled=\"").append(rule.enabled())
                    .append("\">\n");
            element(xml, 3, "name", rule.name());
            element(xml, 3, "description", rule.description());
            element(xml, 3, "pattern", rule.pattern());
            element(xml, 3, "replacement", rule.replacement());
            element(xml, 3, "category", rule.category());
            element(xml, 3, "case_sensitive", Boolean.toString(rule.caseSensitive()));
            element(xml, 3, "exclude_pattern", rule.excludePattern());
            xml.append(INDENT).append(INDENT).append("</check>\n");
        }
        xml.append(INDENT).append("</checks>\n");

        xml.append("</").append(ProfileDocumentReader.ROOT).append(">\n");
        return xml.toString();
    }

    static void validate(Profile profile) {
        XmlText.requireRepresentable("Profile field name", profile.name());
        XmlText.requireRepresentable("Profile field description", profile.description());
        XmlText.requireRepresentable("Profile field language", profile.language());
        for (PatternRule rule : profile.rules()) {
            String where = "Check " + rule.order() + " field ";
            XmlText.requireRepresentable(where + "name", rule.name());
            XmlText.requireRepresentable(where + "description", rule.description());
            XmlText.requireRepresentable(where + "pattern", rule.pattern());
            XmlText.requireRepresentable(where + "replacement", rule.replacement());
            XmlText.requireRepresentable(where + "category", rule.category());
            XmlText.requireRepresentable(where + "exclude_pattern", rule.excludePattern());
        }
    }

    private static void element(StringBuilder xml, int level, String name, String value) {
        xml.append(INDENT.repeat(level));
        if (value.isEmpty()) {
            xml.append('<').append(name).append("/>\n");
            return;
        }
        xml.append('<').append(name).append('>')
                .append(XmlText.escape(value))
                .append("</").append(name).append(">\n");
    }
}
