package com.transitgate.infrastructure.io;

import com.transitgate.domain.dataset.model.Dataset;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Excel workbook, first sheet, header in the first row. Cells are read as strings like the CSV loader:
 * numbers in plain notation, date-formatted cells as ISO date-times, blank cells as null.
 * Rows without any value are skipped.
 */
@Slf4j
@Component
public class XlsxDatasetLoader implements DatasetLoader {

    @Override
    public boolean supports(Path path) {
        String extension = DatasetLoader.extensionOf(path);
        return extension.equals("xlsx") || extension.equals("xls");
    }

    @Override
    public Dataset load(Path path, String name) {
        if (!Files.isReadable(path)) {
            throw new DatasetLoadException("Dataset file not readable: " + path);
        }

        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new DatasetLoadException("Workbook has no sheet: " + path);
            }
            Sheet sheet = workbook.getSheetAt(0);
            List<Map<String, String>> records = readSheet(sheet, path);
            log.info("[Loader] {}: {} rows from sheet '{}' of {}", name, records.size(), sheet.getSheetName(), path);
            return Dataset.fromRows(name, records);
        } catch (DatasetLoadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DatasetLoadException("Cannot read Excel dataset " + path + ": " + e.getMessage(), e);
        }
    }

    private List<Map<String, String>> readSheet(Sheet sheet, Path path) {
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            throw new DatasetLoadException("Excel dataset has no header row: " + path);
        }

        List<String> headers = new ArrayList<>();
        for (int col = 0; col < headerRow.getLastCellNum(); col++) {
            String header = cellText(headerRow.getCell(col));
            headers.add(header == null ? null : header.strip());
        }

        List<Map<String, String>> records = new ArrayList<>();
        for (int rowNum = headerRow.getRowNum() + 1; rowNum <= sheet.getLastRowNum(); rowNum++) {
            Row row = sheet.getRow(rowNum);
            if (row == null) {
                continue;
            }
            Map<String, String> record = new LinkedHashMap<>();
            boolean hasValue = false;
            for (int col = 0; col < headers.size(); col++) {
                String header = headers.get(col);
                if (header == null || header.isEmpty()) {
                    continue;
                }
                String value = cellText(row.getCell(col));
                hasValue |= value != null;
                record.put(header, value);
            }
            if (hasValue) {
                records.add(record);
            }
        }
        return records;
    }

    private static String cellText(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toString();
                }
                return plain(cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return null;
        }
    }

    private static String plain(double number) {
        BigDecimal decimal = BigDecimal.valueOf(number);
        return decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString();
    }
}
