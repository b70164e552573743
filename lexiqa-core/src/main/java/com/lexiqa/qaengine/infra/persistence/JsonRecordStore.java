package com.lexiqa.qaengine.infra.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lexiqa.qaengine.api.RecordStore;
import com.lexiqa.qaengine.api.model.TextRecord;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RecordStore} over a JSON array of records:
 *
 * <pre>
 * [ {"id": "1", "source": "Price", "target": "Pris", "metadata": {}} ]
 * </pre>
 *
 * <p>Records are persisted to {@code outputPath}, which may be the input file itself.
 */
public class JsonRecordStore implements RecordStore {

    private final ObjectMapper objectMapper;
    private final Path inputPath;
    private final Path outputPath;

    public JsonRecordStore(Path inputPath) {
        this(inputPath, inputPath, new ObjectMapper());
    }

    public JsonRecordStore(Path inputPath, Path outputPath, ObjectMapper objectMapper) {
        this.inputPath = Objects.requireNonNull(inputPath, "inputPath cannot be null");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    @Override
    public String sourceId() {
        return inputPath.getFileName().toString();
    }

    @Override
    public List<TextRecord> list() throws IOException {
        try (InputStream in = Files.newInputStream(inputPath)) {
            return readRecords(objectMapper, in);
        }
    }

    @Override
    public String persist(List<TextRecord> records) throws IOException {
        String json = objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(records);
        DocumentFiles.writeAtomically(outputPath, json);
        return outputPath.toAbsolutePath().toString();
    }

    @Override
    public Optional<Path> overwrittenDocument() {
        return Files.isRegularFile(outputPath) ? Optional.of(outputPath) : Optional.empty();
    }

    public Path getInputPath() {
        return inputPath;
    }

    static List<TextRecord> readRecords(ObjectMapper objectMapper, InputStream in) throws IOException {
        List<TextRecord> records = objectMapper.readValue(in,
                objectMapper.getTypeFactory().constructCollectionType(List.class, TextRecord.class));
        return records == null ? List.of() : records;
    }
}
