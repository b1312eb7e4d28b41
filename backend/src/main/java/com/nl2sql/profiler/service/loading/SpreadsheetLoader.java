package com.nl2sql.profiler.service.loading;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;

import com.nl2sql.profiler.exception.DatasetLoadException;
import com.nl2sql.profiler.model.ColumnarTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the first sheet of an XLSX or XLS workbook. The first non-empty row is the header; cells
 * are converted to the same string form a delimited file would carry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpreadsheetLoader {

  private final TableAssembler tableAssembler;

  public ColumnarTable load(byte[] bytes, String fileName) {
    try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new DatasetLoadException("Workbook has no sheets: " + fileName);
      }
      Sheet sheet = workbook.getSheetAt(0);
      log.debug("Reading sheet '{}' of {}", sheet.getSheetName(), fileName);

      Row headerRow = sheet.getRow(sheet.getFirstRowNum());
      if (headerRow == null || headerRow.getLastCellNum() <= 0) {
        throw new DatasetLoadException("Sheet has no header row: " + fileName);
      }
      int width = headerRow.getLastCellNum();
      String[] header = readRow(headerRow, width);

      List<String[]> records = new ArrayList<>();
      for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
        Row row = sheet.getRow(r);
        if (row == null) {
          continue;
        }
        records.add(readRow(row, Math.max(width, row.getLastCellNum())));
      }
      return tableAssembler.assemble(header, records, fileName);
    } catch (IOException | EncryptedDocumentException e) {
      throw new DatasetLoadException("Could not read workbook " + fileName, e);
    }
  }

  private String[] readRow(Row row, int width) {
    String[] cells = new String[width];
    for (int c = 0; c < width; c++) {
      cells[c] = cellText(row.getCell(c));
    }
    return trimTrailingNulls(cells);
  }

  static String cellText(Cell cell) {
    if (cell == null) {
      return null;
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
      case STRING:
        return cell.getStringCellValue();
      case BOOLEAN:
        return String.valueOf(cell.getBooleanCellValue());
      case NUMERIC:
        if (DateUtil.isCellDateFormatted(cell)) {
          LocalDateTime value = cell.getLocalDateTimeCellValue();
          return value.toLocalTime().equals(LocalTime.MIDNIGHT)
              ? value.toLocalDate().toString()
              : value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        return numberText(cell.getNumericCellValue());
      default:
        return null;
    }
  }

  static String numberText(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return String.valueOf((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  /** Formatted but empty trailing cells must not make a record look wider than the header. */
  private static String[] trimTrailingNulls(String[] cells) {
    int end = cells.length;
    while (end > 0 && cells[end - 1] == null) {
      end--;
    }
    return end == cells.length ? cells : Arrays.copyOf(cells, end);
  }
}
