/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.insight2d.specdata.formats.csv;

import com.google.auto.service.AutoService;
import io.insight2d.specdata.api.errors.SpectrumParseException;
import io.insight2d.specdata.api.fileio.FileOutputs;
import io.insight2d.specdata.api.fileio.SpectrumDecoder;
import io.insight2d.specdata.api.fileio.SpectrumEncoder;
import io.insight2d.specdata.api.record.MetaValue;
import io.insight2d.specdata.api.record.SpectrumRecord;
import io.insight2d.specdata.api.services.Format;
import io.insight2d.specdata.api.services.SpectrumFormat;
import io.insight2d.specdata.formats.NumericTokens;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads and writes spectrum records as a labelled CSV table.
///
/// The header row holds an index label cell followed by the f2 axis values. Every following row
/// holds its f1 axis value followed by the spectrum cells of that row:
/// ```
/// ,0.0,0.5,1.0
/// 0.0,1.0,2.0,3.0
/// 1.0,4.0,5.0,6.0
/// ```
///
/// Only derived metadata survives a round trip: the decoder reports [#META_FILE_FORMAT],
/// [#META_ORIGINAL_FILE] and [#META_DATA_SHAPE], and the encoder does not store metadata.
@AutoService({SpectrumDecoder.class, SpectrumEncoder.class})
@Format(SpectrumFormat.csv)
public class CsvSpectrumCodec implements SpectrumDecoder, SpectrumEncoder {
  private static final Logger logger = LogManager.getLogger(CsvSpectrumCodec.class);

  public static final String META_FILE_FORMAT = "file_format";
  public static final String META_ORIGINAL_FILE = "original_file";
  public static final String META_DATA_SHAPE = "data_shape";

  @Override
  public SpectrumRecord decode(Path path) {
    List<Double> f1 = new ArrayList<>();
    List<double[]> rows = new ArrayList<>();
    double[] f2 = null;
    int lineNumber = 0;

    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        String[] cells = parseCsvLine(line);
        if (f2 == null) {
          if (cells.length < 2) {
            throw new SpectrumParseException(
                "Header has no frequency columns", path, SpectrumFormat.csv, lineNumber, null);
          }
          f2 = new double[cells.length - 1];
          for (int j = 1; j < cells.length; j++) {
            f2[j - 1] = parseAxisCell(cells[j], "header", path, lineNumber);
          }
          continue;
        }
        if (cells.length != f2.length + 1) {
          throw new SpectrumParseException(
              "Expected " + (f2.length + 1) + " cells but found " + cells.length, path,
              SpectrumFormat.csv, lineNumber, null);
        }
        f1.add(parseAxisCell(cells[0], "index", path, lineNumber));
        double[] values = new double[f2.length];
        for (int j = 1; j < cells.length; j++) {
          String cell = cells[j].strip();
          if (cell.isEmpty()) {
            values[j - 1] = Double.NaN;
            continue;
          }
          try {
            values[j - 1] = NumericTokens.parse(cell);
          } catch (NumberFormatException e) {
            throw new SpectrumParseException(
                "Non-numeric value '" + cell + "'", path, SpectrumFormat.csv, lineNumber, e);
          }
        }
        rows.add(values);
      }
    } catch (IOException e) {
      throw new SpectrumParseException("Unable to read CSV data", path, SpectrumFormat.csv, e);
    }

    if (f2 == null) {
      throw new SpectrumParseException("Missing header row", path, SpectrumFormat.csv, null);
    }
    if (rows.isEmpty()) {
      throw new SpectrumParseException("No data rows", path, SpectrumFormat.csv, null);
    }

    double[] axisF1 = new double[f1.size()];
    for (int i = 0; i < axisF1.length; i++) {
      axisF1[i] = f1.get(i);
    }
    Map<String, MetaValue> metadata = new LinkedHashMap<>();
    metadata.put(META_FILE_FORMAT, MetaValue.of(SpectrumFormat.csv.name()));
    metadata.put(META_ORIGINAL_FILE, MetaValue.of(path.toString()));
    metadata.put(META_DATA_SHAPE, MetaValue.of(axisF1.length + "x" + f2.length));

    logger.debug("read {}x{} spectrum from {}", axisF1.length, f2.length, path);
    return new SpectrumRecord(rows.toArray(new double[0][]), axisF1, f2, metadata);
  }

  @Override
  public void encode(SpectrumRecord record, Path path) {
    if (!record.metadata().isEmpty()) {
      logger.debug("CSV does not store metadata, dropping {} entries for {}",
          record.metadata().size(), path);
    }
    double[] f1 = record.axisF1();
    double[] f2 = record.axisF2();
    FileOutputs.writeReplacing(path, SpectrumFormat.csv, tempFile -> {
      try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
        StringBuilder header = new StringBuilder();
        for (double v : f2) {
          header.append(',').append(NumericTokens.format(v));
        }
        writer.write(header.toString());
        writer.newLine();
        for (int i = 0; i < f1.length; i++) {
          StringBuilder sb = new StringBuilder(NumericTokens.format(f1[i]));
          for (double v : record.row(i)) {
            sb.append(',').append(NumericTokens.format(v));
          }
          writer.write(sb.toString());
          writer.newLine();
        }
      }
    });
    logger.debug("wrote {}x{} spectrum to {}", record.rows(), record.columns(), path);
  }

  private double parseAxisCell(String cell, String where, Path path, int lineNumber) {
    String trimmed = cell.strip();
    try {
      return NumericTokens.parse(trimmed);
    } catch (NumberFormatException e) {
      throw new SpectrumParseException(
          "Non-numeric " + where + " value '" + trimmed + "'", path, SpectrumFormat.csv,
          lineNumber, e);
    }
  }

  /// Split one CSV line into cells. Double quotes group a cell and a doubled quote inside
  /// quotes is a literal quote.
  static String[] parseCsvLine(String line) {
    List<String> fields = new ArrayList<>();
    boolean inQuotes = false;
    StringBuilder currentField = new StringBuilder();

    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '"') {
        if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
          currentField.append('"');
          i++;
        } else {
          inQuotes = !inQuotes;
        }
      } else if (c == ',' && !inQuotes) {
        fields.add(currentField.toString());
        currentField = new StringBuilder();
      } else {
        currentField.append(c);
      }
    }
    fields.add(currentField.toString());
    return fields.toArray(new String[0]);
  }
}
