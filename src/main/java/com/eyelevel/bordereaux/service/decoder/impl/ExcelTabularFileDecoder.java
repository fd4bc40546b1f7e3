package com.eyelevel.bordereaux.service.decoder.impl;

import com.eyelevel.bordereaux.exception.DecodeException;
import com.eyelevel.bordereaux.service.decoder.DecodedTable;
import com.eyelevel.bordereaux.service.decoder.TabularFileDecoder;
import com.eyelevel.bordereaux.service.decoder.TableSink;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * XLSX and XLS via Apache POI. Only the first sheet is read; date cells are rendered as ISO dates and other
 * cells as Excel displays them.
 */
@Slf4j
@Component
public class ExcelTabularFileDecoder implements TabularFileDecoder {

    private static final Set<String> EXTENSIONS = Set.of("xlsx", "xls");

    @Override
    public boolean supports(final String extension) {
        return EXTENSIONS.contains(extension);
    }

    @Override
    public DecodedTable decode(final byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new DecodeException("Workbook has no sheets");
            }
            final Sheet sheet = workbook.getSheetAt(0);
            final FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            final DataFormatter formatter = new DataFormatter(Locale.ENGLISH);
            final TableSink sink = new TableSink();

            for (Row row : sheet) {
                final List<String> cells = readCells(row, formatter, evaluator);
                if (!sink.hasHeader()) {
                    if (!TableSink.isBlank(cells)) {
                        sink.header(cells);
                    }
                } else {
                    sink.row(cells);
                }
            }
            final DecodedTable table = sink.build();
            log.debug("Decoded sheet '{}' with {} columns and {} rows.", sheet.getSheetName(),
                      table.headers().size(), table.rowCount());
            return table;
        } catch (DecodeException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Unreadable workbook: " + e.getMessage(), e);
        }
    }

    private static List<String> readCells(final Row row, final DataFormatter formatter,
                                          final FormulaEvaluator evaluator) {
        final int lastCell = Math.max(row.getLastCellNum(), 0);
        final List<String> cells = new ArrayList<>(lastCell);
        for (int column = 0; column < lastCell; column++) {
            final Cell cell = row.getCell(column, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            cells.add(cell == null ? "" : render(cell, formatter, evaluator));
        }
        return cells;
    }

    private static String render(final Cell cell, final DataFormatter formatter, final FormulaEvaluator evaluator) {
        final CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType()
                                                                      : cell.getCellType();
        if (type == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate().toString();
        }
        return formatter.formatCellValue(cell, evaluator);
    }
}
