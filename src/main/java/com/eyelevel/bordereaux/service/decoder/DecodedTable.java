package com.eyelevel.bordereaux.service.decoder;

import java.util.List;
import java.util.Map;

/**
 * Decoder output: ordered headers and data rows keyed by header. Rows keep source order.
 */
public record DecodedTable(List<String> headers, List<Map<String, String>> rows) {

    public DecodedTable {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }
}
