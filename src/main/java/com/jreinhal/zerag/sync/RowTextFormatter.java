package com.jreinhal.zerag.sync;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders database rows as indexable text: {@code table <name> record: k1=v1, k2=v2}.
 */
public final class RowTextFormatter {

    static final String ID_COLUMN = "id";

    private RowTextFormatter() {
    }

    /**
     * Null values are left out; column order follows the row map.
     */
    public static String format(String table, Map<String, Object> row) {
        StringJoiner fields = new StringJoiner(", ");
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getValue() != null) {
                fields.add(entry.getKey() + "=" + entry.getValue());
            }
        }
        return "table " + table + " record: " + fields;
    }

    /**
     * Value of the {@code id} column (matched case-insensitively), else the row's ordinal.
     */
    public static String locator(Map<String, Object> row, int ordinal) {
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (ID_COLUMN.equalsIgnoreCase(entry.getKey()) && entry.getValue() != null) {
                return String.valueOf(entry.getValue());
            }
        }
        return String.valueOf(ordinal);
    }
}
