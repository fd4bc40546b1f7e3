package com.eyelevel.bordereaux.service.suggestion;

import java.util.List;
import java.util.Map;

/**
 * What the suggestion generator knows about an unrecognized file.
 *
 * @param headers    file headers in source order
 * @param sampleRows first few data rows, possibly empty
 */
public record SuggestionContext(List<String> headers, List<Map<String, String>> sampleRows, String filename,
                                String sender, String subject) {

    public SuggestionContext {
        headers = List.copyOf(headers);
        sampleRows = sampleRows == null ? List.of() : List.copyOf(sampleRows);
    }
}
