package br.edu.ifba.resolution.merge;

import br.edu.ifba.resolution.core.Record;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Records produced by a resolution strategy.
 * 
 * <p>In merge mode {@code records} holds one record per cluster plus the
 * unclustered records and {@code links} is empty. In link mode every accepted
 * record is kept and {@code links} relates the records of each cluster.</p>
 *
 * @param mode strategy that produced this resolution
 * @param records resulting records in id order
 * @param links same-as links in pair order
 */
public record Resolution(@NotNull ResolutionMode mode, @NotNull List<Record> records, @NotNull List<SameAsLink> links) {
    
    public Resolution {
        records = List.copyOf(records);
        links = List.copyOf(links);
    }
}
