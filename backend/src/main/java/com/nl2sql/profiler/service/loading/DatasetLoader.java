package com.nl2sql.profiler.service.loading;

import org.springframework.stereotype.Service;

import com.nl2sql.profiler.exception.DatasetLoadException;
import com.nl2sql.profiler.model.ColumnarTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Entry point of the loading stage: dispatches raw bytes to a format loader by file extension. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetLoader {

  private final DelimitedTextLoader delimitedTextLoader;
  private final SpreadsheetLoader spreadsheetLoader;

  public ColumnarTable load(byte[] bytes, String fileName) {
    if (bytes == null || bytes.length == 0) {
      throw new DatasetLoadException("File is empty: " + fileName);
    }
    String extension = FileNames.extension(fileName);
    log.info("Loading {} ({} bytes)", fileName, bytes.length);

    ColumnarTable table =
        switch (extension) {
          case "csv", "tsv", "txt" -> delimitedTextLoader.load(bytes, fileName);
          case "xlsx", "xls" -> spreadsheetLoader.load(bytes, fileName);
          default -> throw new DatasetLoadException(
              "Unsupported file type '" + extension + "' for " + fileName);
        };

    log.info(
        "Loaded {} with {} rows and {} columns",
        fileName,
        table.getRowCount(),
        table.getColumnCount());
    return table;
  }
}
