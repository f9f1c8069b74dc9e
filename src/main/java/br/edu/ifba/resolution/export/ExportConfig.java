package br.edu.ifba.resolution.export;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Configuration for resolution graph export.
 * 
 * <h2>Supported Formats:</h2>
 * <ul>
 *   <li>{@code json} - one document with {@code nodes} and {@code edges} arrays</li>
 *   <li>{@code csv} - a nodes section and an edges section, each with a header row</li>
 * </ul>
 * 
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * ExportConfig config = ExportConfig.builder()
 *     .format(ExportFormat.JSON)
 *     .includeMasters(true)
 *     .includeSimilarityEdges(false)
 *     .maxItems(500)
 *     .build();
 * }</pre>
 * 
 * @param format The export format (json, csv)
 * @param includeMasters Whether to export master entity nodes and ASSIGNED_TO edges
 * @param includeSimilarityEdges Whether to export SIMILAR_TO edges
 * @param maxItems Maximum number of nodes, and of edges, to export (null = unlimited)
 * @param displayField Raw field shown as node display name, falling back to the id
 */
public record ExportConfig(
    @NotNull ExportFormat format,
    boolean includeMasters,
    boolean includeSimilarityEdges,
    @Nullable Integer maxItems,
    @NotNull String displayField
) {
    
    public static final String DEFAULT_DISPLAY_FIELD = "full_name";
    
    /**
     * Compact constructor with validation.
     */
    public ExportConfig {
        Objects.requireNonNull(format, "format must not be null");
        if (maxItems != null && maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be > 0 or null, got: " + maxItems);
        }
        if (displayField == null || displayField.isBlank()) {
            displayField = DEFAULT_DISPLAY_FIELD;
        }
    }
    
    /**
     * Creates a default configuration for the specified format.
     */
    public static ExportConfig defaultFor(@NotNull ExportFormat format) {
        return new ExportConfig(format, true, true, null, DEFAULT_DISPLAY_FIELD);
    }
    
    public int limit() {
        return maxItems != null ? maxItems : Integer.MAX_VALUE;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Export formats.
     */
    public enum ExportFormat {
        JSON("application/json", "json"),
        CSV("text/csv", "csv");
        
        private final String mimeType;
        private final String extension;
        
        ExportFormat(String mimeType, String extension) {
            this.mimeType = mimeType;
            this.extension = extension;
        }
        
        public String getMimeType() {
            return mimeType;
        }
        
        public String getExtension() {
            return extension;
        }
        
        /**
         * Parses format from string, case-insensitive.
         * 
         * @param value The string value
         * @return Matching ExportFormat, JSON when blank
         * @throws IllegalArgumentException if value doesn't match
         */
        public static ExportFormat fromString(@Nullable String value) {
            if (value == null || value.isBlank()) {
                return JSON;
            }
            
            try {
                return valueOf(value.toUpperCase(Locale.ROOT).trim());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "Invalid export format: '" + value + "'. Valid values: json, csv"
                );
            }
        }
    }
    
    /**
     * Builder for ExportConfig.
     */
    public static class Builder {
        private ExportFormat format = ExportFormat.JSON;
        private boolean includeMasters = true;
        private boolean includeSimilarityEdges = true;
        private Integer maxItems = null;
        private String displayField = DEFAULT_DISPLAY_FIELD;
        
        public Builder format(@NotNull ExportFormat format) {
            this.format = format;
            return this;
        }
        
        public Builder format(@NotNull String format) {
            this.format = ExportFormat.fromString(format);
            return this;
        }
        
        public Builder includeMasters(boolean includeMasters) {
            this.includeMasters = includeMasters;
            return this;
        }
        
        public Builder includeSimilarityEdges(boolean includeSimilarityEdges) {
            this.includeSimilarityEdges = includeSimilarityEdges;
            return this;
        }
        
        public Builder maxItems(@Nullable Integer maxItems) {
            this.maxItems = maxItems;
            return this;
        }
        
        public Builder displayField(@NotNull String displayField) {
            this.displayField = displayField;
            return this;
        }
        
        public ExportConfig build() {
            return new ExportConfig(format, includeMasters, includeSimilarityEdges, maxItems, displayField);
        }
    }
}
