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

import io.insight2d.specdata.api.errors.SpectrumDataException;
import io.insight2d.specdata.api.record.MetaValue;
import io.insight2d.specdata.api.record.SpectrumRecord;
import io.insight2d.specdata.api.services.SpectrumFileIO;
import io.insight2d.specdata.api.services.SpectrumFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/// Convert a spectrum file from one format to another, optionally attaching metadata.
@CommandLine.Command(name = "convert",
    header = "Convert between spectrum file formats",
    description = "Read a spectrum file in any supported format and write it in another "
                  + "(h5, txt, dat, csv)",
    exitCodeList = {"0: success", "2: error"})
public class CMD_convert implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_convert.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_ERROR = 2;

  @CommandLine.Option(names = {"-i", "--input"}, description = "Input spectrum file",
      required = true)
  private Path inputPath;

  @CommandLine.Option(names = {"-o", "--output"}, description = "Output spectrum file",
      required = true)
  private Path outputPath;

  @CommandLine.Option(names = {"--output-format"},
      description = "Output format name or extension (overrides the output file extension)")
  private String outputFormat;

  @CommandLine.Option(names = {"-f", "--force"},
      description = "Force overwrite if output file already exists")
  private boolean force = false;

  @CommandLine.Option(names = {"-m", "--meta"},
      description = "Metadata entry to attach, as key=value; the value may carry a type prefix "
                    + "such as (text)0042 or (real)3")
  private Map<String, String> meta = new LinkedHashMap<>();

  private final SpectrumFileIO fileIO;

  /// create the command with the codecs found on the class path
  public CMD_convert() {
    this(SpectrumFileIO.defaults());
  }

  CMD_convert(SpectrumFileIO fileIO) {
    this.fileIO = fileIO;
  }

  @Override
  public Integer call() {
    if (Files.exists(outputPath) && !force) {
      logger.error("Output file {} already exists. Use --force to overwrite.", outputPath);
      return EXIT_ERROR;
    }
    try {
      Map<String, MetaValue> extra = new LinkedHashMap<>();
      for (Map.Entry<String, String> entry : meta.entrySet()) {
        extra.put(entry.getKey(), MetaValue.parse(entry.getValue()));
      }

      SpectrumRecord record = fileIO.decode(inputPath);
      if (!extra.isEmpty()) {
        record = record.withMetadata(extra);
      }
      if (outputFormat != null) {
        SpectrumFormat format = SpectrumFormat.fromName(outputFormat);
        fileIO.encode(record, format, outputPath);
        System.out.println("Converted " + inputPath + " to " + outputPath + " as " + format);
      } else {
        fileIO.encode(record, outputPath);
        System.out.println("Converted " + inputPath + " to " + outputPath);
      }
      return EXIT_SUCCESS;
    } catch (SpectrumDataException e) {
      logger.error("Conversion of {} failed: {}", inputPath, e.getMessage());
      logger.debug("failure detail", e);
      return EXIT_ERROR;
    } catch (IllegalArgumentException e) {
      logger.error("Invalid metadata value: {}", e.getMessage());
      return EXIT_ERROR;
    }
  }
}
