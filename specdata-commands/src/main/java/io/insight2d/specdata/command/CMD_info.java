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

package io.insight2d.specdata.command;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.insight2d.specdata.api.errors.SpectrumDataException;
import io.insight2d.specdata.api.record.MetaValue;
import io.insight2d.specdata.api.record.SpectrumRecord;
import io.insight2d.specdata.api.services.SpectrumFileIO;
import io.insight2d.specdata.api.summary.AxisRange;
import io.insight2d.specdata.api.summary.SpectrumIntrospector;
import io.insight2d.specdata.api.summary.SpectrumSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/// Print a summary of one or more spectrum files
@CommandLine.Command(name = "info",
    header = "Summarize spectrum files",
    description = "Print shape, value range, mean, standard deviation, axis ranges and metadata "
                  + "of each spectrum file",
    exitCodeList = {"0: success", "2: error"})
public class CMD_info implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_info.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Spectrum files")
  private List<Path> files;

  @CommandLine.Option(names = {"--json"}, description = "Print each summary as JSON")
  private boolean json = false;

  private final SpectrumFileIO fileIO;

  /// create the command with the codecs found on the class path
  public CMD_info() {
    this(SpectrumFileIO.defaults());
  }

  CMD_info(SpectrumFileIO fileIO) {
    this.fileIO = fileIO;
  }

  @Override
  public Integer call() {
    int failures = 0;
    for (Path file : files) {
      try {
        SpectrumRecord record = fileIO.decode(file);
        SpectrumSummary summary = SpectrumIntrospector.summarize(record);
        System.out.println(json ? toJson(file, summary) : toText(file, summary));
      } catch (SpectrumDataException e) {
        logger.error("{}: {}", file, e.getMessage());
        logger.debug("failure detail for {}", file, e);
        failures++;
      }
    }
    return failures == 0 ? EXIT_SUCCESS : EXIT_ERROR;
  }

  static String toText(Path file, SpectrumSummary summary) {
    StringBuilder sb = new StringBuilder();
    sb.append("file: ").append(file).append('\n');
    sb.append("  shape: ").append(summary.rows()).append(" x ").append(summary.columns())
        .append('\n');
    sb.append("  value type: ").append(summary.valueType()).append('\n');
    sb.append("  range: [").append(fmt(summary.min())).append(", ").append(fmt(summary.max()))
        .append("]\n");
    sb.append("  mean: ").append(fmt(summary.mean())).append('\n');
    sb.append("  std: ").append(fmt(summary.std())).append('\n');
    sb.append("  f1 axis: ").append(range(summary.f1Range())).append('\n');
    sb.append("  f2 axis: ").append(range(summary.f2Range())).append('\n');
    if (summary.metadata().isEmpty()) {
      sb.append("  metadata: (none)");
    } else {
      sb.append("  metadata:");
      for (Map.Entry<String, MetaValue> entry : summary.metadata().entrySet()) {
        sb.append("\n    ").append(entry.getKey()).append(": ").append(entry.getValue())
            .append(" (").append(entry.getValue().type().name().toLowerCase(Locale.ROOT))
            .append(')');
      }
    }
    return sb.toString();
  }

  static String toJson(Path file, SpectrumSummary summary) {
    JsonObject json = new JsonObject();
    json.addProperty("file", file.toString());
    JsonArray shape = new JsonArray();
    shape.add(summary.rows());
    shape.add(summary.columns());
    json.add("shape", shape);
    json.addProperty("dtype", summary.valueType());
    json.addProperty("min", summary.min());
    json.addProperty("max", summary.max());
    json.addProperty("mean", summary.mean());
    json.addProperty("std", summary.std());
    json.add("f1_range", toJson(summary.f1Range()));
    json.add("f2_range", toJson(summary.f2Range()));
    JsonObject metadata = new JsonObject();
    summary.metadata().forEach((key, value) -> {
      Object v = value.value();
      if (v instanceof Number n) {
        metadata.addProperty(key, n);
      } else if (v instanceof Boolean b) {
        metadata.addProperty(key, b);
      } else {
        metadata.addProperty(key, value.toString());
      }
    });
    json.add("metadata", metadata);
    return gson().toJson(json);
  }

  private static JsonArray toJson(AxisRange range) {
    JsonArray array = new JsonArray();
    array.add(range.min());
    array.add(range.max());
    return array;
  }

  private static Gson gson() {
    return new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create();
  }

  private static String range(AxisRange range) {
    return "[" + fmt(range.min()) + ", " + fmt(range.max()) + "]";
  }

  private static String fmt(double value) {
    return String.format(Locale.ROOT, "%.6g", value);
  }
}
