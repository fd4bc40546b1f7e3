package com.eyelevel.bordereaux.service.decoder;

import com.eyelevel.bordereaux.exception.DecodeException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects header and data cells from any decoder. Blank header cells drop their column, repeated headers get a
 * numeric suffix and fully blank rows are skipped.
 */
public final class TableSink {

    private final List<String> headers = new ArrayList<>();
    private final List<Integer> columnIndexes = new ArrayList<>();
    private final List<Map<String, String>> rows = new ArrayList<>();
    private boolean headerSeen;

    public boolean hasHeader() {
        return headerSeen;
    }

    public void header(final List<String> cells) {
        final Map<String, Integer> occurrences = new HashMap<>();
        for (int column = 0; column < cells.size(); column++) {
            final String cell = cells.get(column) == null ? "" : cells.get(column).trim();
            if (cell.isEmpty()) {
                continue;
            }
            final int seen = occurrences.merge(cell, 1, Integer::sum);
            headers.add(seen == 1 ? cell : cell + "_" + seen);
            columnIndexes.add(column);
        }
        headerSeen = !headers.isEmpty();
    }

    public void row(final List<String> cells) {
        final Map<String, String> row = new LinkedHashMap<>();
        boolean blank = true;
        for (int i = 0; i < headers.size(); i++) {
            final int column = columnIndexes.get(i);
            final String value = column < cells.size() && cells.get(column) != null ? cells.get(column).trim() : "";
            if (!value.isEmpty()) {
                blank = false;
            }
            row.put(headers.get(i), value);
        }
        if (!blank) {
            rows.add(row);
        }
    }

    public DecodedTable build() {
        if (!headerSeen) {
            throw new DecodeException("File has no header row");
        }
        return new DecodedTable(headers, rows);
    }

    public static boolean isBlank(final List<String> cells) {
        return cells.stream().allMatch(cell -> cell == null || cell.isBlank());
    }
}
