package com.paymentsengine.cli.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.paymentsengine.domain.events.EventValidator;
import com.paymentsengine.domain.events.InvalidInputException;
import com.paymentsengine.domain.events.InvalidInputReason;
import com.paymentsengine.domain.events.RawPaymentRecord;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Streams a transactions CSV as {@link RawPaymentRecord}s, one row at a time.
 *
 * <p>The first non-blank line is the header; its names must be a subset of {@code type, client,
 * tx, amount} in any order. Cells are trimmed. Rows shorter than the header leave the trailing
 * fields absent, rows longer than the header are rejected. Header problems surface on the first
 * call to {@link #hasNext()} so they abort the run like any other input error.
 *
 * <p>Each record is one physical line and carries its 1-based line number. A cell cannot span
 * lines.
 */
public final class CsvPaymentRecordReader implements Iterator<RawPaymentRecord>, Closeable {
  private static final char BYTE_ORDER_MARK = '\uFEFF';
  private static final ObjectReader ROW_READER =
      CsvMapper.builder()
          .enable(CsvParser.Feature.TRIM_SPACES)
          .build()
          .readerFor(String[].class);

  private final BufferedReader lines;
  private long lineNumber;
  private List<String> header;
  private RawPaymentRecord next;

  private CsvPaymentRecordReader(BufferedReader lines) {
    this.lines = lines;
  }

  public static CsvPaymentRecordReader open(Path path) throws IOException {
    return new CsvPaymentRecordReader(Files.newBufferedReader(path, StandardCharsets.UTF_8));
  }

  public static CsvPaymentRecordReader open(Reader reader) {
    return new CsvPaymentRecordReader(
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader));
  }

  @Override
  public boolean hasNext() {
    if (next == null) {
      next = readRecord();
    }
    return next != null;
  }

  @Override
  public RawPaymentRecord next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more payment records");
    }
    RawPaymentRecord record = next;
    next = null;
    return record;
  }

  @Override
  public void close() throws IOException {
    lines.close();
  }

  private RawPaymentRecord readRecord() {
    if (header == null) {
      header = readHeader();
    }
    Row row = readRow();
    if (row == null) {
      return null;
    }
    if (row.cells().length > header.size()) {
      throw new InvalidInputException(
          InvalidInputReason.UNKNOWN_FIELD,
          row.lineNumber(),
          row.cells().length + " cells for " + header.size() + " columns");
    }
    Map<String, String> fields = new LinkedHashMap<>();
    for (int i = 0; i < row.cells().length; i++) {
      fields.put(header.get(i), row.cells()[i]);
    }
    return new RawPaymentRecord(row.lineNumber(), fields);
  }

  private List<String> readHeader() {
    Row row = readRow();
    if (row == null) {
      throw new InvalidInputException(InvalidInputReason.INVALID_HEADER, 1L, "input is empty");
    }

    List<String> names = new ArrayList<>(row.cells().length);
    Set<String> seen = new HashSet<>();
    for (String cell : row.cells()) {
      String name = cell.trim();
      if (!EventValidator.RECOGNISED_FIELDS.contains(name)) {
        throw new InvalidInputException(InvalidInputReason.UNKNOWN_FIELD, row.lineNumber(), name);
      }
      if (!seen.add(name)) {
        throw new InvalidInputException(
            InvalidInputReason.INVALID_HEADER, row.lineNumber(), "duplicate column " + name);
      }
      names.add(name);
    }
    return names;
  }

  /** Next non-blank line split into cells, or {@code null} at end of input. */
  private Row readRow() {
    String line;
    do {
      line = readLine();
      if (line == null) {
        return null;
      }
      if (lineNumber == 1L && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
        line = line.substring(1);
      }
    } while (line.isBlank());

    try {
      return new Row(lineNumber, ROW_READER.readValue(line));
    } catch (JsonProcessingException ex) {
      throw new InvalidInputException(
          InvalidInputReason.MALFORMED_RECORD, lineNumber, ex.getOriginalMessage(), ex);
    }
  }

  private String readLine() {
    try {
      String line = lines.readLine();
      if (line != null) {
        lineNumber++;
      }
      return line;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read transactions input", ex);
    }
  }

  private record Row(long lineNumber, String[] cells) {}
}
