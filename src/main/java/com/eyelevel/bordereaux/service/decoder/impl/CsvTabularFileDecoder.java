package com.eyelevel.bordereaux.service.decoder.impl;

import com.eyelevel.bordereaux.exception.DecodeException;
import com.eyelevel.bordereaux.service.decoder.DecodedTable;
import com.eyelevel.bordereaux.service.decoder.TabularFileDecoder;
import com.eyelevel.bordereaux.service.decoder.TableSink;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

/**
 * CSV via Apache Commons CSV. Content is read as UTF-8 (BOM stripped) and falls back to windows-1252 when it
 * is not valid UTF-8.
 */
@Slf4j
@Component
public class CsvTabularFileDecoder implements TabularFileDecoder {

    private static final Set<String> EXTENSIONS = Set.of("csv", "txt");
    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .build();

    @Override
    public boolean supports(final String extension) {
        return EXTENSIONS.contains(extension);
    }

    @Override
    public DecodedTable decode(final byte[] content) {
        final String text = stripBom(toText(content));
        final TableSink sink = new TableSink();
        try (CSVParser parser = CSVParser.parse(text, FORMAT)) {
            for (CSVRecord record : parser) {
                final List<String> cells = record.toList();
                if (!sink.hasHeader()) {
                    if (!TableSink.isBlank(cells)) {
                        sink.header(cells);
                    }
                } else {
                    sink.row(cells);
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new DecodeException("Malformed CSV content: " + e.getMessage(), e);
        }
        final DecodedTable table = sink.build();
        log.debug("Decoded CSV with {} columns and {} rows.", table.headers().size(), table.rowCount());
        return table;
    }

    private static String toText(final byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("CSV content is not valid UTF-8, decoding as windows-1252.");
            return new String(content, WINDOWS_1252);
        }
    }

    private static String stripBom(final String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }
}
