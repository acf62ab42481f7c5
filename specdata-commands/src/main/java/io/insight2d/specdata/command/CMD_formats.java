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

import io.insight2d.specdata.api.services.SpectrumCodecRegistry;
import io.insight2d.specdata.api.services.SpectrumFileIO;
import io.insight2d.specdata.api.services.SpectrumFormat;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// List the known spectrum formats and which of them can be read or written
@CommandLine.Command(name = "formats", header = "List supported spectrum formats")
public class CMD_formats implements Callable<Integer> {

  private final SpectrumFileIO fileIO;

  public CMD_formats() {
    this(SpectrumFileIO.defaults());
  }

  CMD_formats(SpectrumFileIO fileIO) {
    this.fileIO = fileIO;
  }

  @Override
  public Integer call() {
    SpectrumCodecRegistry registry = fileIO.getRegistry();
    System.out.println(String.format("%-12s %-14s %-6s %-6s", "format", "extensions", "decode",
        "encode"));
    for (SpectrumFormat format : SpectrumFormat.values()) {
      System.out.println(String.format("%-12s %-14s %-6s %-6s",
          format.name(),
          String.join(",", format.getExtensions()),
          registry.decoderFor(format).isPresent() ? "yes" : "no",
          registry.encoderFor(format).isPresent() ? "yes" : "no"));
    }
    return 0;
  }
}
