package com.example.examSchedulerBackend.service;

import com.example.examSchedulerBackend.model.Semester;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellValue;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Reads a student roster from the first sheet of an Excel workbook. Columns
 * follow the CSV roster: semester, batch, register number; or semester,
 * register number; or register number alone.
 */
@Slf4j
@Service
public class RosterExcelService {

    public List<Semester> readRoster(InputStream inputStream) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(inputStream)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IllegalArgumentException("Workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            RosterFileParser.RosterBuilder roster = new RosterFileParser.RosterBuilder();

            for (Row row : sheet) {
                int width = Math.max(row.getLastCellNum(), 0);
                String first = getEvaluatedStringCellValue(row.getCell(0), evaluator);
                if (row.getRowNum() == 0 && isHeader(first, row, evaluator)) {
                    continue;
                }
                if (width >= 3) {
                    String registerNumber = getEvaluatedStringCellValue(row.getCell(2), evaluator);
                    if (registerNumber.isEmpty()) continue;
                    roster.add(first.toUpperCase(Locale.ROOT),
                            getEvaluatedStringCellValue(row.getCell(1), evaluator).toUpperCase(Locale.ROOT),
                            registerNumber);
                } else if (width == 2) {
                    String registerNumber = getEvaluatedStringCellValue(row.getCell(1), evaluator);
                    if (registerNumber.isEmpty()) continue;
                    roster.add(first.toUpperCase(Locale.ROOT), RosterFileParser.DEFAULT_BATCH, registerNumber);
                } else if (!first.isEmpty()) {
                    roster.add(RosterFileParser.DEFAULT_SEMESTER, RosterFileParser.DEFAULT_BATCH, first);
                }
            }
            List<Semester> semesters = roster.build();
            log.info("Read {} register numbers from sheet '{}'", RosterFileParser.countStudents(semesters),
                    sheet.getSheetName());
            return semesters;
        }
    }

    private boolean isHeader(String first, Row row, FormulaEvaluator evaluator) {
        StringBuilder text = new StringBuilder(first);
        for (Cell cell : row) {
            text.append(' ').append(getEvaluatedStringCellValue(cell, evaluator));
        }
        String lower = text.toString().toLowerCase(Locale.ROOT);
        return lower.contains("semester") || lower.contains("batch")
                || lower.contains("register") || lower.contains("roll");
    }

    private String getEvaluatedStringCellValue(Cell cell, FormulaEvaluator evaluator) {
        if (cell == null) return "";
        CellValue cellValue = evaluator.evaluate(cell);
        if (cellValue == null) return "";
        switch (cellValue.getCellType()) {
            case STRING: return cellValue.getStringValue().trim();
            case NUMERIC: return String.valueOf((long) cellValue.getNumberValue());
            case BOOLEAN: return String.valueOf(cellValue.getBooleanValue());
            default: return "";
        }
    }
}
