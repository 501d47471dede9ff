package in.lhbflow.transform;

import in.lhbflow.infrastructure.provider.response.NormalizedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renames upstream fields to the canonical columns of a target table.
 *
 * For each canonical column the first source name present wins (exact match first, then
 * case-insensitive). Other source names of the same column are dropped. Fields matching no
 * column keep their upstream name and are reported as unmatched.
 */
public class ColumnAligner {
    private static final Logger log = LoggerFactory.getLogger(ColumnAligner.class);

    private final ColumnSynonyms synonyms;

    public ColumnAligner(ColumnSynonyms synonyms) {
        this.synonyms = synonyms;
    }

    public record AlignmentResult(List<NormalizedRow> rows, Set<String> unmatchedColumns) {
        public AlignmentResult {
            rows = List.copyOf(rows);
            unmatchedColumns = Set.copyOf(unmatchedColumns);
        }
    }

    public AlignmentResult align(List<NormalizedRow> rows, TargetTable table) {
        Map<String, List<String>> columns = synonyms.columns(table);
        List<NormalizedRow> aligned = new ArrayList<>(rows.size());
        Set<String> unmatched = new LinkedHashSet<>();

        for (NormalizedRow row : rows) {
            Map<String, String> byLowerCase = new LinkedHashMap<>();
            for (String field : row.fields()) {
                byLowerCase.putIfAbsent(field.toLowerCase(Locale.ROOT), field);
            }

            Map<String, Object> out = new LinkedHashMap<>();
            Set<String> consumed = new HashSet<>();
            for (Map.Entry<String, List<String>> column : columns.entrySet()) {
                String source = findSource(row, byLowerCase, column.getValue());
                if (source == null) {
                    continue;
                }
                out.put(column.getKey(), row.get(source));
                for (String name : column.getValue()) {
                    String present = row.has(name) ? name : byLowerCase.get(name.toLowerCase(Locale.ROOT));
                    if (present != null) {
                        consumed.add(present);
                    }
                }
            }
            for (String field : row.fields()) {
                if (!consumed.contains(field) && !out.containsKey(field)) {
                    out.put(field, row.get(field));
                    unmatched.add(field);
                }
            }
            aligned.add(NormalizedRow.of(out));
        }

        if (!unmatched.isEmpty()) {
            log.warn("[ColumnAligner] {} columns not mapped for {}: {}", unmatched.size(), table.tableName(), unmatched);
        }
        return new AlignmentResult(aligned, unmatched);
    }

    private static String findSource(NormalizedRow row, Map<String, String> byLowerCase, List<String> names) {
        for (String name : names) {
            if (row.has(name)) {
                return name;
            }
        }
        for (String name : names) {
            String field = byLowerCase.get(name.toLowerCase(Locale.ROOT));
            if (field != null) {
                return field;
            }
        }
        return null;
    }
}
