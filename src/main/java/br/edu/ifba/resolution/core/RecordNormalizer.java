package br.edu.ifba.resolution.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw field values into comparable forms.
 * 
 * <p>Normalization is total and deterministic: it never throws, and the same
 * raw value always yields the same normalized value. It is also idempotent,
 * so normalizing an already-normalized value returns it unchanged. A value
 * the field rule cannot make sense of normalizes to its own lowercased,
 * trimmed form.</p>
 */
@ApplicationScoped
public class RecordNormalizer {
    
    private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);
    
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]");
    
    private static final Set<String> HONORIFICS = Set.of(
        "mr", "mrs", "ms", "miss", "mx", "dr", "prof", "sir", "madam", "jr", "sr"
    );
    
    private static final Map<String, String> ADDRESS_ABBREVIATIONS = Map.ofEntries(
        Map.entry("st", "street"),
        Map.entry("str", "street"),
        Map.entry("ave", "avenue"),
        Map.entry("av", "avenue"),
        Map.entry("rd", "road"),
        Map.entry("blvd", "boulevard"),
        Map.entry("dr", "drive"),
        Map.entry("ln", "lane"),
        Map.entry("ct", "court"),
        Map.entry("pl", "place"),
        Map.entry("sq", "square"),
        Map.entry("hwy", "highway"),
        Map.entry("pkwy", "parkway"),
        Map.entry("apt", "apartment"),
        Map.entry("ste", "suite"),
        Map.entry("fl", "floor"),
        Map.entry("n", "north"),
        Map.entry("s", "south"),
        Map.entry("e", "east"),
        Map.entry("w", "west"),
        Map.entry("ne", "northeast"),
        Map.entry("nw", "northwest"),
        Map.entry("se", "southeast"),
        Map.entry("sw", "southwest")
    );
    
    /**
     * Normalizes every typed field present on a record.
     *
     * @param record raw record with a valid identifier
     * @param settings run settings (phone country code and national length)
     * @return the normalized record
     */
    @NotNull
    public NormalizedRecord normalize(@NotNull Record record, @NotNull ResolutionSettings settings) {
        Map<FieldType, FieldValue> values = new EnumMap<>(FieldType.class);
        
        for (FieldType type : FieldType.values()) {
            String raw = record.value(type);
            if (raw != null) {
                values.put(type, new FieldValue(raw, normalize(raw, type, settings)));
            }
        }
        
        return new NormalizedRecord(record.id(), record, values);
    }
    
    /**
     * Normalizes a single raw value according to its field type.
     *
     * @param raw raw value (null is treated as empty)
     * @param type field type tag
     * @param settings run settings
     * @return normalized value, never null
     */
    @NotNull
    public String normalize(String raw, @NotNull FieldType type, @NotNull ResolutionSettings settings) {
        if (raw == null) {
            return "";
        }
        
        String normalized;
        switch (type) {
            case NAME:
                normalized = normalizeName(raw);
                break;
            case EMAIL:
                normalized = raw.trim().toLowerCase(Locale.ROOT);
                break;
            case PHONE:
                normalized = normalizePhone(raw, settings.phoneCountryCode(), settings.phoneNationalLength());
                break;
            case ADDRESS:
                normalized = normalizeAddress(raw);
                break;
            case POSTAL_CODE:
                normalized = NON_ALPHANUMERIC.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("");
                break;
            default:
                normalized = "";
        }
        
        if (normalized.isEmpty()) {
            String fallback = fallback(raw);
            if (!fallback.isEmpty()) {
                logger.debug("Value '{}' has no {} form, keeping '{}'", raw, type, fallback);
            }
            return fallback;
        }
        return normalized;
    }
    
    /**
     * Lowercase, strip diacritics and punctuation, drop honorifics, collapse whitespace.
     */
    String normalizeName(String raw) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String token : tokens(raw)) {
            if (!HONORIFICS.contains(token)) {
                joiner.add(token);
            }
        }
        return joiner.toString();
    }
    
    /**
     * Digits only, with a recognized country-code prefix removed when the
     * remainder has the national length.
     */
    String normalizePhone(String raw, String countryCode, int nationalLength) {
        String digits = NON_DIGITS.matcher(raw).replaceAll("");
        if (countryCode == null || countryCode.isEmpty()) {
            return digits;
        }
        
        String international = "00" + countryCode;
        if (digits.startsWith(international) && digits.length() == international.length() + nationalLength) {
            return digits.substring(international.length());
        }
        if (digits.startsWith(countryCode) && digits.length() == countryCode.length() + nationalLength) {
            return digits.substring(countryCode.length());
        }
        return digits;
    }
    
    /**
     * Lowercase, strip punctuation, expand street-type and directional
     * abbreviations, collapse whitespace.
     */
    String normalizeAddress(String raw) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String token : tokens(raw)) {
            joiner.add(ADDRESS_ABBREVIATIONS.getOrDefault(token, token));
        }
        return joiner.toString();
    }
    
    private String[] tokens(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        String decomposed = Normalizer.normalize(lower, Normalizer.Form.NFKD);
        String cleaned = COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
        cleaned = APOSTROPHES.matcher(cleaned).replaceAll("");
        cleaned = PUNCTUATION.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return new String[0];
        }
        return WHITESPACE.split(cleaned);
    }
    
    private String fallback(String raw) {
        return WHITESPACE.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
