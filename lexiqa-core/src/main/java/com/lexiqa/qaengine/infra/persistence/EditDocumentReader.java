package com.lexiqa.qaengine.infra.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.RecordEdit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a JSON array of {@code {"id": ..., "target": ...}} edits, in application order.
 */
public class EditDocumentReader {

    private final ObjectMapper objectMapper;

    public EditDocumentReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<RecordEdit> read(Path path) throws ResourceNotFoundException, IOException {
        if (!Files.isRegularFile(path)) {
            throw new ResourceNotFoundException("Edit file", path.toString());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public List<RecordEdit> read(InputStream in) throws IOException {
        List<RecordEdit> edits = objectMapper.readValue(in,
                objectMapper.getTypeFactory().constructCollectionType(List.class, RecordEdit.class));
        return edits == null ? List.of() : edits;
    }
}
