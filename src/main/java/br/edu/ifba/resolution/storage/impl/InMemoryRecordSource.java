package br.edu.ifba.resolution.storage.impl;

import br.edu.ifba.resolution.core.Record;
import br.edu.ifba.resolution.storage.RecordSource;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Record source over a fixed list, used by tests and embedding callers.
 */
public class InMemoryRecordSource implements RecordSource {
    
    private final List<Record> records;
    
    public InMemoryRecordSource(@NotNull List<Record> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        this.records = List.copyOf(records);
    }
    
    @NotNull
    @Override
    public List<Record> loadRecords() {
        return records;
    }
}
