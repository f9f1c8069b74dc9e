package br.edu.ifba.resolution.blocking;

import br.edu.ifba.resolution.core.FieldType;
import br.edu.ifba.resolution.core.NormalizedRecord;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * A combination of field parts that derives one block key.
 * 
 * <p>Rules are written as parts joined by {@code +}; each part is a field key
 * with an optional {@code :N} prefix length over the normalized value with
 * whitespace removed:</p>
 * <pre>
 * name:3+postal_code   first 3 name characters + postal code
 * phone:6              first 6 phone digits
 * email                whole normalized email
 * </pre>
 */
public final class BlockingRule {
    
    /**
     * One field of a rule.
     *
     * @param field the field read
     * @param prefixLength characters kept, 0 for the whole value
     */
    public record Part(FieldType field, int prefixLength) {
        
        @Override
        public String toString() {
            return prefixLength > 0 ? field.key() + ":" + prefixLength : field.key();
        }
    }
    
    private final String expression;
    private final List<Part> parts;
    
    private BlockingRule(String expression, List<Part> parts) {
        this.expression = expression;
        this.parts = List.copyOf(parts);
    }
    
    /**
     * Parses a rule expression.
     *
     * @param expression e.g. {@code name:3+postal_code}
     * @return the parsed rule
     * @throws IllegalArgumentException if the expression is malformed or names an unknown field
     */
    @NotNull
    public static BlockingRule parse(@NotNull String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Blocking rule cannot be blank");
        }
        
        List<Part> parts = new ArrayList<>();
        for (String token : expression.split("\\+")) {
            String part = token.trim();
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Blocking rule '" + expression + "' has an empty part");
            }
            
            int colon = part.indexOf(':');
            FieldType field = FieldType.fromKey(colon >= 0 ? part.substring(0, colon) : part);
            int prefixLength = 0;
            if (colon >= 0) {
                try {
                    prefixLength = Integer.parseInt(part.substring(colon + 1).trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                        "Blocking rule '" + expression + "' has a non-numeric prefix length in '" + part + "'"
                    );
                }
                if (prefixLength <= 0) {
                    throw new IllegalArgumentException(
                        "Blocking rule '" + expression + "' needs a positive prefix length in '" + part + "'"
                    );
                }
            }
            parts.add(new Part(field, prefixLength));
        }
        
        return new BlockingRule(expression.trim(), parts);
    }
    
    /**
     * Derives this rule's key for a record.
     *
     * @param record normalized record
     * @param ruleIndex position of the rule in the configuration, keeps keys of different rules apart
     * @return the key, or empty when any part has no comparable value
     */
    @NotNull
    public Optional<String> keyFor(@NotNull NormalizedRecord record, int ruleIndex) {
        StringJoiner key = new StringJoiner("|");
        key.add(String.valueOf(ruleIndex));
        
        for (Part part : parts) {
            String value = record.comparable(part.field());
            if (value == null) {
                return Optional.empty();
            }
            String compact = value.replace(" ", "");
            if (compact.isEmpty()) {
                return Optional.empty();
            }
            if (part.prefixLength() > 0 && compact.length() > part.prefixLength()) {
                compact = compact.substring(0, part.prefixLength());
            }
            key.add(compact);
        }
        
        return Optional.of(key.toString());
    }
    
    public List<Part> parts() {
        return parts;
    }
    
    @Override
    public String toString() {
        return expression;
    }
}
