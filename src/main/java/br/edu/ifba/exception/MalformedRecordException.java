package br.edu.ifba.exception;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when an ingested record violates a structural invariant
 * (missing or duplicate identifier). The record is rejected; the run continues.
 */
public class MalformedRecordException extends RuntimeException {
    
    @Nullable
    private final String recordId;
    
    public MalformedRecordException(@Nullable final String recordId, final String message) {
        super(message);
        this.recordId = recordId;
    }
    
    @Nullable
    public String getRecordId() {
        return recordId;
    }
}
