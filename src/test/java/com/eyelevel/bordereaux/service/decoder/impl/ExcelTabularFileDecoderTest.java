package com.eyelevel.bordereaux.service.decoder.impl;

import com.eyelevel.bordereaux.exception.DecodeException;
import com.eyelevel.bordereaux.service.decoder.DecodedTable;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExcelTabularFileDecoderTest {

    private final ExcelTabularFileDecoder decoder = new ExcelTabularFileDecoder();

    private static byte[] workbook() throws IOException {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Premium");
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("dd/mm/yyyy"));

            sheet.createRow(1).createCell(0).setCellValue("Policy No");
            sheet.getRow(1).createCell(1).setCellValue("Inception");
            sheet.getRow(1).createCell(2).setCellValue("Premium");
            sheet.getRow(1).createCell(3).setCellValue("Doubled");

            Row data = sheet.createRow(2);
            data.createCell(0).setCellValue("P-1");
            data.createCell(1).setCellValue(LocalDate.of(2024, 3, 15));
            data.getCell(1).setCellStyle(dateStyle);
            data.createCell(2).setCellValue(1250.5);
            data.createCell(3).setCellFormula("C3*2");

            sheet.createRow(3).createCell(0).setCellValue("   ");
            sheet.createRow(4).createCell(2).setCellValue(10);

            workbook.write(out);
            return out.toByteArray();
        }
    }

    @Test
    @DisplayName("reads the first sheet with ISO dates, displayed numbers and evaluated formulas")
    void readsWorkbook() throws IOException {
        DecodedTable table = decoder.decode(workbook());

        assertThat(table.headers()).containsExactly("Policy No", "Inception", "Premium", "Doubled");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.rows().get(0))
                .containsEntry("Policy No", "P-1")
                .containsEntry("Inception", "2024-03-15")
                .containsEntry("Premium", "1250.5")
                .containsEntry("Doubled", "2501");
        assertThat(table.rows().get(1)).containsEntry("Policy No", "").containsEntry("Premium", "10");
    }

    @Test
    @DisplayName("bytes that are not a workbook are rejected")
    void notAWorkbook() {
        assertThatThrownBy(() -> decoder.decode("just text".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    @DisplayName("workbook without any header cells is rejected")
    void noHeader() throws IOException {
        byte[] content;
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            workbook.createSheet("Empty");
            workbook.write(out);
            content = out.toByteArray();
        }

        assertThatThrownBy(() -> decoder.decode(content))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("no header row");
    }
}
