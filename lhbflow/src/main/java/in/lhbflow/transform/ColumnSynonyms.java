package in.lhbflow.transform;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical column names per target table and the upstream field names that map onto them.
 *
 * Loaded from a JSON resource shaped as
 * {@code {"trade_flow": {"code": ["ths_stock_code_stock", "thscode"], ...}, ...}}.
 * The canonical name always matches itself and is tried before its synonyms.
 */
public class ColumnSynonyms {
    private static final Logger log = LoggerFactory.getLogger(ColumnSynonyms.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "column-synonyms.json";

    private final Map<TargetTable, Map<String, List<String>>> tables;

    public ColumnSynonyms(Map<TargetTable, Map<String, List<String>>> tables) {
        Map<TargetTable, Map<String, List<String>>> copy = new LinkedHashMap<>();
        for (Map.Entry<TargetTable, Map<String, List<String>>> e : tables.entrySet()) {
            Map<String, List<String>> columns = new LinkedHashMap<>();
            for (Map.Entry<String, List<String>> c : e.getValue().entrySet()) {
                List<String> names = new ArrayList<>();
                names.add(c.getKey());
                for (String synonym : c.getValue()) {
                    if (!names.contains(synonym)) {
                        names.add(synonym);
                    }
                }
                columns.put(c.getKey(), List.copyOf(names));
            }
            copy.put(e.getKey(), Collections.unmodifiableMap(columns));
        }
        this.tables = Collections.unmodifiableMap(copy);
    }

    public static ColumnSynonyms loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load from a classpath resource.
     *
     * @throws IllegalStateException if the resource is missing, malformed or names an unknown table
     */
    public static ColumnSynonyms load(String resource) {
        try (InputStream in = ColumnSynonyms.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Column synonym resource not found: " + resource);
            }
            Map<String, Map<String, List<String>>> raw =
                MAPPER.readValue(in, new TypeReference<Map<String, Map<String, List<String>>>>() {});

            Map<TargetTable, Map<String, List<String>>> tables = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, List<String>>> e : raw.entrySet()) {
                tables.put(tableFor(e.getKey()), e.getValue());
            }
            ColumnSynonyms synonyms = new ColumnSynonyms(tables);
            log.info("[ColumnSynonyms] Loaded {} tables from {}", tables.size(), resource);
            return synonyms;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read column synonyms from " + resource, e);
        }
    }

    /**
     * Canonical columns of a table, each with its candidate source names in match order.
     */
    public Map<String, List<String>> columns(TargetTable table) {
        return tables.getOrDefault(table, Map.of());
    }

    private static TargetTable tableFor(String name) {
        for (TargetTable table : TargetTable.values()) {
            if (table.tableName().equalsIgnoreCase(name) || table.name().equalsIgnoreCase(name)) {
                return table;
            }
        }
        throw new IllegalStateException("Unknown target table in column synonyms: " + name);
    }
}
