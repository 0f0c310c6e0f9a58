package org.carball.autoindex.model.schema;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Data
@Builder(toBuilder = true)
public class Index {
    private String name;
    private List<String> columns;
    private boolean unique;
    @Builder.Default
    private boolean valid = true;
    // partial index predicate, null for a full index
    private String predicate;

    public String leadingColumn() {
        return columns == null || columns.isEmpty() ? null : columns.get(0);
    }

    /**
     * Whether a lookup on {@code field} for {@code tenantId} can be served by this index.
     * A full index covers the field when it leads with it, or with the tenant column
     * followed by the field. A partial index only covers the tenant its predicate
     * compares the tenant column to, whether the literal is quoted, cast or bare.
     */
    public boolean covers(String field, String tenantColumn, String tenantId) {
        if (!valid || columns == null || columns.isEmpty() || field == null) {
            return false;
        }
        boolean columnsMatch = field.equalsIgnoreCase(columns.get(0))
                || (tenantColumn != null && columns.size() >= 2
                    && tenantColumn.equalsIgnoreCase(columns.get(0))
                    && field.equalsIgnoreCase(columns.get(1)));
        if (!columnsMatch) {
            return false;
        }
        if (predicate == null || predicate.isBlank()) {
            return true;
        }
        return tenantId != null && tenantColumn != null && predicateNames(tenantColumn, tenantId);
    }

    private boolean predicateNames(String tenantColumn, String tenantId) {
        // matches tenant_id = 'x', "tenant_id" = 'x'::text, ((tenant_id)::text = 'x'::text) and tenant_id = 42
        Pattern equality = Pattern.compile("(?<![\\w.])\"?" + Pattern.quote(tenantColumn) + "\"?\\s*\\)?"
                + "(?:\\s*::\\s*[\\w ]+?)?\\s*=\\s*\\(?\\s*(?:'((?:[^']|'')*)'|(-?[\\w.]+))",
                Pattern.CASE_INSENSITIVE);
        Matcher matcher = equality.matcher(predicate);
        while (matcher.find()) {
            String literal = matcher.group(1) != null ? matcher.group(1).replace("''", "'") : matcher.group(2);
            if (tenantId.equals(literal)) {
                return true;
            }
        }
        return false;
    }
}
