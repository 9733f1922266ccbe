package com.wagesearch.salary.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public record RawRow(long rowNumber, Map<String, RawCell> cells) {

    public RawRow {
        Map<String, RawCell> normalized = new LinkedHashMap<>();
        if (cells != null) {
            cells.forEach((column, cell) -> {
                if (column != null && !column.isBlank()) {
                    normalized.put(normalizeColumn(column), cell == null ? RawCell.ABSENT : cell);
                }
            });
        }
        cells = Collections.unmodifiableMap(normalized);
    }

    public static RawRow of(long rowNumber, Map<String, ?> values) {
        Map<String, RawCell> cells = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((column, value) -> cells.put(column, RawCell.of(value)));
        }
        return new RawRow(rowNumber, cells);
    }

    public RawCell get(String column) {
        if (column == null) {
            return RawCell.ABSENT;
        }
        return cells.getOrDefault(normalizeColumn(column), RawCell.ABSENT);
    }

    private static String normalizeColumn(String column) {
        return column.trim().toUpperCase(Locale.ROOT);
    }
}
