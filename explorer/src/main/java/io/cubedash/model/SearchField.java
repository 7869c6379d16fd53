package io.cubedash.model;

import java.util.List;
import java.util.Locale;

/**
 * A searchable field declared by a catalog metadata type.
 *
 * <p>
 * Plain fields have one document path in {@code offset}; range fields
 * ({@code *-range} types) have a {@code minOffset} and a {@code maxOffset}.
 * </p>
 */
public record SearchField(
        String name,
        String type,
        String description,
        List<String> offset,
        List<String> minOffset,
        List<String> maxOffset) {

    public boolean isRange() {
        return type != null && type.endsWith("-range");
    }

    /**
     * Postgres type used to compare values of this field.
     */
    public String sqlType() {
        String base = type == null ? "string" : type.toLowerCase(Locale.ROOT).replace("-range", "");
        return switch (base) {
            case "double", "float", "numeric" -> "double precision";
            case "integer" -> "bigint";
            case "datetime" -> "timestamptz";
            default -> "text";
        };
    }

    public boolean isNumeric() {
        String t = sqlType();
        return t.equals("double precision") || t.equals("bigint");
    }
}
