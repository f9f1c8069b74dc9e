package br.edu.ifba.resolution.storage;

import br.edu.ifba.resolution.core.Record;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Supplies the batch of candidate records for one run.
 * 
 * Implementations: InMemoryRecordSource, JsonRecordSource
 */
public interface RecordSource {
    
    /**
     * Loads all records of the batch. Records are returned as read: ids are
     * validated later so that one malformed record does not fail the ingest.
     *
     * @return the records, in source order
     * @throws java.io.UncheckedIOException if the underlying source cannot be read
     */
    @NotNull
    List<Record> loadRecords();
}
