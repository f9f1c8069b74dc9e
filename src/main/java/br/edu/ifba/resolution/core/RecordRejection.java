package br.edu.ifba.resolution.core;

import org.jetbrains.annotations.Nullable;

/**
 * A record refused at ingest.
 *
 * @param recordId the offending id, null when the record had none
 * @param reason why it was rejected
 */
public record RecordRejection(@Nullable String recordId, String reason) {
}
