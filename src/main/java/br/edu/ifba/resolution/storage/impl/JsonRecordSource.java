package br.edu.ifba.resolution.storage.impl;

import br.edu.ifba.resolution.core.Record;
import br.edu.ifba.resolution.storage.RecordSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads records from a JSON array of flat objects.
 * 
 * <pre>
 * [
 *   {"id": "r1", "full_name": "John Smith", "email": "john@example.com"},
 *   {"id": "r2", "name": "Jon Smith", "phone": "(555) 123-4567"}
 * ]
 * </pre>
 * 
 * <p>The id is read from {@code id}. Scalar fields become raw string values;
 * nulls are skipped and nested values are kept as their JSON text.</p>
 */
public class JsonRecordSource implements RecordSource {
    
    private static final Logger logger = LoggerFactory.getLogger(JsonRecordSource.class);
    
    public static final String ID_FIELD = "id";
    
    private final Path filePath;
    private final ObjectMapper mapper;
    
    public JsonRecordSource(@NotNull Path filePath) {
        this(filePath, new ObjectMapper());
    }
    
    public JsonRecordSource(@NotNull Path filePath, @NotNull ObjectMapper mapper) {
        if (filePath == null) {
            throw new IllegalArgumentException("filePath cannot be null");
        }
        this.filePath = filePath;
        this.mapper = mapper;
    }
    
    @NotNull
    @Override
    public List<Record> loadRecords() {
        try (InputStream in = Files.newInputStream(filePath)) {
            List<Record> records = read(in);
            logger.info("Loaded {} records from {}", records.size(), filePath);
            return records;
        } catch (IOException e) {
            logger.error("Failed to read records from {}", filePath, e);
            throw new UncheckedIOException("Failed to read records from " + filePath, e);
        }
    }
    
    /**
     * Parses records from a stream holding a JSON array.
     *
     * @throws IOException if the content is not valid JSON or not an array of objects
     */
    @NotNull
    public List<Record> read(@NotNull InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of records");
        }
        
        List<Record> records = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                throw new IOException("Element " + index + " is not a JSON object");
            }
            records.add(toRecord(node));
            index++;
        }
        return records;
    }
    
    private Record toRecord(JsonNode node) {
        String id = null;
        Map<String, String> fields = new LinkedHashMap<>();
        
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            String text = value.isValueNode() ? value.asText() : value.toString();
            if (ID_FIELD.equals(field.getKey())) {
                id = text;
            } else {
                fields.put(field.getKey(), text);
            }
        }
        
        return Record.of(id, fields);
    }
}
