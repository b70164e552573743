package com.lexiqa.qaengine.api;

import com.lexiqa.qaengine.api.model.TextRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Source and sink of the records a batch works on.
 * The engine never talks to a store directly; callers list, run, then persist.
 */
public interface RecordStore {

    /**
     * Identifier of the underlying document, reported as the source of a find run.
     */
    String sourceId();

    /**
     * @return records in store order
     * @throws IOException if the records cannot be read
     */
    List<TextRecord> list() throws IOException;

    /**
     * Writes the records back.
     *
     * @param records records to persist
     * @return identifier of the location written to
     * @throws IOException if the records cannot be written
     */
    String persist(List<TextRecord> records) throws IOException;

    /**
     * Existing file that {@link #persist(List)} would overwrite, so callers can back it up
     * first. Stores that do not write to a file return empty.
     */
    default Optional<Path> overwrittenDocument() {
        return Optional.empty();
    }
}
