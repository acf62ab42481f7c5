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

package io.insight2d.specdata.formats.text;

import com.google.auto.service.AutoService;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.insight2d.specdata.api.errors.SpectrumDataException;
import io.insight2d.specdata.api.errors.SpectrumParseException;
import io.insight2d.specdata.api.errors.UnsupportedMetadataTypeException;
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
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads and writes spectrum records as whitespace-delimited numeric text, with metadata in an
/// optional JSON sidecar named `<basename>.json` next to the data file.
///
/// The text holds only the spectrum matrix. Axes are not stored; on decode both axes are
/// regenerated as evenly spaced values from [#DEFAULT_AXIS_MIN] to [#DEFAULT_AXIS_MAX].
@AutoService({SpectrumDecoder.class, SpectrumEncoder.class})
@Format(SpectrumFormat.text)
public class DelimitedTextCodec implements SpectrumDecoder, SpectrumEncoder {
  private static final Logger logger = LogManager.getLogger(DelimitedTextCodec.class);

  public static final double DEFAULT_AXIS_MIN = 0.0d;
  public static final double DEFAULT_AXIS_MAX = 12.0d;
  public static final String SIDECAR_EXTENSION = ".json";

  private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  @Override
  public SpectrumRecord decode(Path path) {
    double[][] spectrum = readMatrix(path);
    Map<String, MetaValue> metadata = readSidecar(sidecarFor(path));
    int rows = spectrum.length;
    int columns = spectrum[0].length;
    logger.debug("read {}x{} spectrum from {} with {} metadata entries", rows, columns, path,
        metadata.size());
    return new SpectrumRecord(
        spectrum,
        linspace(DEFAULT_AXIS_MIN, DEFAULT_AXIS_MAX, rows),
        linspace(DEFAULT_AXIS_MIN, DEFAULT_AXIS_MAX, columns),
        metadata
    );
  }

  @Override
  public void encode(SpectrumRecord record, Path path) {
    if (!Arrays.equals(record.axisF1(), linspace(DEFAULT_AXIS_MIN, DEFAULT_AXIS_MAX, record.rows()))
        || !Arrays.equals(
        record.axisF2(), linspace(DEFAULT_AXIS_MIN, DEFAULT_AXIS_MAX, record.columns())))
    {
      logger.warn("axis values are not stored in text format; {} will decode with default axes",
          path);
    }

    JsonObject json = toJson(record.metadata(), path);
    FileOutputs.writeReplacing(path, SpectrumFormat.text, tempFile -> {
      try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
        for (int i = 0; i < record.rows(); i++) {
          double[] row = record.row(i);
          StringBuilder sb = new StringBuilder();
          for (int j = 0; j < row.length; j++) {
            if (j > 0) {
              sb.append(' ');
            }
            sb.append(NumericTokens.format(row[j]));
          }
          writer.write(sb.toString());
          writer.newLine();
        }
      }
    });

    Path sidecar = sidecarFor(path);
    if (json.size() == 0) {
      try {
        if (Files.deleteIfExists(sidecar)) {
          logger.debug("removed stale sidecar {}", sidecar);
        }
      } catch (IOException e) {
        throw new SpectrumDataException(
            "Unable to remove stale sidecar " + sidecar + ": " + e.getMessage(), sidecar,
            SpectrumFormat.text, e);
      }
    } else {
      FileOutputs.writeReplacing(sidecar, SpectrumFormat.text, tempFile -> {
        try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
          gson.toJson(json, writer);
        }
      });
    }
    logger.debug("wrote {}x{} spectrum to {}", record.rows(), record.columns(), path);
  }

  /// The sidecar path for a data file, `a/b/name.txt` -> `a/b/name.json`.
  public static Path sidecarFor(Path dataFile) {
    String name = dataFile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return dataFile.resolveSibling(base + SIDECAR_EXTENSION);
  }

  /// Evenly spaced values over `[min, max]` with both endpoints included.
  /// @param min
  ///     the first value
  /// @param max
  ///     the last value, unless count is 1
  /// @param count
  ///     the number of values
  /// @return the values
  public static double[] linspace(double min, double max, int count) {
    double[] values = new double[count];
    if (count == 0) {
      return values;
    }
    if (count == 1) {
      values[0] = min;
      return values;
    }
    double step = (max - min) / (count - 1);
    for (int i = 0; i < count; i++) {
      values[i] = min + i * step;
    }
    values[count - 1] = max;
    return values;
  }

  private double[][] readMatrix(Path path) {
    List<double[]> rows = new ArrayList<>();
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        String[] tokens = trimmed.split("\\s+");
        if (!rows.isEmpty() && tokens.length != rows.get(0).length) {
          throw new SpectrumParseException(
              "Expected " + rows.get(0).length + " values but found " + tokens.length, path,
              SpectrumFormat.text, lineNumber, null);
        }
        double[] values = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
          try {
            values[i] = NumericTokens.parse(tokens[i]);
          } catch (NumberFormatException e) {
            throw new SpectrumParseException(
                "Non-numeric value '" + tokens[i] + "'", path, SpectrumFormat.text, lineNumber, e);
          }
        }
        rows.add(values);
      }
    } catch (IOException e) {
      throw new SpectrumParseException("Unable to read text data", path, SpectrumFormat.text, e);
    }
    if (rows.isEmpty()) {
      throw new SpectrumParseException("No data rows", path, SpectrumFormat.text, null);
    }
    return rows.toArray(new double[0][]);
  }

  private Map<String, MetaValue> readSidecar(Path sidecar) {
    Map<String, MetaValue> metadata = new LinkedHashMap<>();
    if (!Files.exists(sidecar)) {
      return metadata;
    }
    JsonElement root;
    try (Reader reader = Files.newBufferedReader(sidecar, StandardCharsets.UTF_8)) {
      root = JsonParser.parseReader(reader);
    } catch (IOException | JsonParseException e) {
      throw new SpectrumParseException(
          "Invalid metadata sidecar: " + e.getMessage(), sidecar, SpectrumFormat.text, e);
    }
    if (!root.isJsonObject()) {
      throw new SpectrumParseException(
          "Metadata sidecar must hold a JSON object", sidecar, SpectrumFormat.text, null);
    }
    for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject().entrySet()) {
      metadata.put(entry.getKey(), toMetaValue(entry.getKey(), entry.getValue(), sidecar));
    }
    return metadata;
  }

  private MetaValue toMetaValue(String key, JsonElement element, Path sidecar) {
    if (element.isJsonPrimitive()) {
      JsonPrimitive primitive = element.getAsJsonPrimitive();
      if (primitive.isBoolean()) {
        return MetaValue.of(primitive.getAsBoolean());
      } else if (primitive.isString()) {
        return MetaValue.of(primitive.getAsString());
      } else if (primitive.isNumber()) {
        String literal = primitive.getAsString();
        if (literal.matches("-?\\d+")) {
          try {
            return MetaValue.of(Long.parseLong(literal));
          } catch (NumberFormatException e) {
            logger.debug("integer '{}' for key '{}' exceeds long range, keeping as real", literal,
                key);
          }
        }
        return MetaValue.of(primitive.getAsDouble());
      }
    }
    String kind = element.isJsonNull() ? "null" : element.isJsonArray() ? "array" : "object";
    throw new UnsupportedMetadataTypeException(key, kind, sidecar, SpectrumFormat.text);
  }

  private JsonObject toJson(Map<String, MetaValue> metadata, Path path) {
    JsonObject json = new JsonObject();
    metadata.forEach((key, value) -> {
      switch (value.type()) {
        case INTEGER:
          json.addProperty(key, value.asLong());
          break;
        case REAL:
          if (!Double.isFinite(value.asDouble())) {
            throw new UnsupportedMetadataTypeException(
                key, "non-finite REAL", path, SpectrumFormat.text);
          }
          json.addProperty(key, value.asDouble());
          break;
        case FLAG:
          json.addProperty(key, value.asFlag());
          break;
        default:
          json.addProperty(key, value.asText());
      }
    });
    return json;
  }
}
