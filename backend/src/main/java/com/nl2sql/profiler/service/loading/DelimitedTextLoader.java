package com.nl2sql.profiler.service.loading;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.exception.DatasetLoadException;
import com.nl2sql.profiler.model.ColumnarTable;
import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Loads CSV, TSV and delimited TXT files with opencsv. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DelimitedTextLoader {

  private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};

  private final ProfilerProperties properties;
  private final TextDecoder textDecoder;
  private final TableAssembler tableAssembler;
  private final PartitionedCsvParser partitionedCsvParser;

  public ColumnarTable load(byte[] bytes, String fileName) {
    String text = textDecoder.decode(bytes);
    if (text.isBlank()) {
      throw new DatasetLoadException("File is empty: " + fileName);
    }
    char delimiter = delimiterFor(FileNames.extension(fileName), text);

    List<String[]> records = null;
    if (bytes.length > properties.getLoader().getLargeFileThresholdBytes()) {
      try {
        records = partitionedCsvParser.parse(text, delimiter);
        log.info(
            "Parsed {} records from {} using partitioned parsing", records.size(), fileName);
      } catch (RuntimeException e) {
        log.warn(
            "Partitioned parsing of {} failed, falling back to single pass: {}",
            fileName,
            e.getMessage());
      }
    }
    if (records == null) {
      records = parse(text, delimiter, fileName);
    }
    if (records.isEmpty()) {
      throw new DatasetLoadException("File has no header row: " + fileName);
    }

    String[] header = records.get(0);
    return tableAssembler.assemble(header, records.subList(1, records.size()), fileName);
  }

  static List<String[]> parse(String text, char delimiter, String fileName) {
    CSVParser parser = new CSVParserBuilder().withSeparator(delimiter).build();
    List<String[]> records = new ArrayList<>();
    try (CSVReader reader =
        new CSVReaderBuilder(new StringReader(text)).withCSVParser(parser).build()) {
      String[] record;
      while ((record = reader.readNext()) != null) {
        records.add(record);
      }
    } catch (IOException | CsvException e) {
      throw new DatasetLoadException("Malformed delimited text in " + fileName, e);
    }
    return records;
  }

  static char delimiterFor(String extension, String text) {
    if ("tsv".equals(extension)) {
      return '\t';
    }
    if (!"txt".equals(extension)) {
      return ',';
    }
    int newline = text.indexOf('\n');
    String headerLine = newline < 0 ? text : text.substring(0, newline);
    char best = ',';
    int bestCount = 0;
    for (char candidate : CANDIDATE_DELIMITERS) {
      int count = (int) headerLine.chars().filter(c -> c == candidate).count();
      if (count > bestCount) {
        best = candidate;
        bestCount = count;
      }
    }
    return best;
  }
}
