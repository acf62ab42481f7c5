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

import io.insight2d.specdata.api.record.MetaType;
import io.insight2d.specdata.api.record.MetaValue;
import io.insight2d.specdata.api.record.SpectrumRecord;
import io.insight2d.specdata.api.services.SpectrumFileIO;
import io.insight2d.specdata.api.services.SpectrumFormat;
import io.insight2d.specdata.formats.hdf5.Hdf5SpectrumCodec;
import io.insight2d.specdata.formats.text.DelimitedTextCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_convertTest {

  @TempDir
  Path tempDir;

  private final SpectrumRecord record = new SpectrumRecord(
      new double[][]{{1.25, -2.5}, {3.0, 0.125}},
      new double[]{0.0, 12.0},
      new double[]{0.0, 12.0});

  @Test
  public void testConvertTextToHdf5WithMetadata() {
    Path input = tempDir.resolve("in.txt");
    new DelimitedTextCodec().encode(record, input);
    Path output = tempDir.resolve("out.h5");

    int exitCode = new CommandLine(new CMD_convert()).execute(
        "-i", input.toString(), "-o", output.toString(),
        "--meta", "scans=16", "--meta", "sample=(text)0042");

    assertThat(exitCode).isEqualTo(0);
    SpectrumRecord converted = new Hdf5SpectrumCodec().decode(output);
    assertThat(converted.spectrum()).isDeepEqualTo(record.spectrum());
    assertThat(converted.metadata().get("scans").type()).isEqualTo(MetaType.INTEGER);
    assertThat(converted.metadata().get("scans").asLong()).isEqualTo(16L);
    assertThat(converted.metadata().get("sample")).isEqualTo(MetaValue.of("0042"));
  }

  @Test
  public void testExplicitOutputFormat() {
    Path input = tempDir.resolve("in.h5");
    new Hdf5SpectrumCodec().encode(record, input);
    Path output = tempDir.resolve("table.out");

    int exitCode = new CommandLine(new CMD_convert()).execute(
        "-i", input.toString(), "-o", output.toString(), "--output-format", "csv");

    assertThat(exitCode).isEqualTo(0);
    assertThat(output).exists();
    SpectrumRecord table = SpectrumFileIO.defaults().getRegistry()
        .decoderFor(SpectrumFormat.csv).orElseThrow().decode(output);
    assertThat(table.axisF2()).containsExactly(0.0, 12.0);
  }

  @Test
  public void testRefusesToOverwriteWithoutForce() throws IOException {
    Path input = tempDir.resolve("in.txt");
    new DelimitedTextCodec().encode(record, input);
    Path output = Files.writeString(tempDir.resolve("exists.csv"), "keep me");

    int exitCode = new CommandLine(new CMD_convert()).execute(
        "-i", input.toString(), "-o", output.toString());
    assertThat(exitCode).isEqualTo(2);
    assertThat(output).hasContent("keep me");

    exitCode = new CommandLine(new CMD_convert()).execute(
        "-i", input.toString(), "-o", output.toString(), "--force");
    assertThat(exitCode).isEqualTo(0);
    assertThat(Files.readString(output)).startsWith(",0.0,12.0");
  }

  @Test
  public void testUnwritableTargetFormatFails() {
    Path input = tempDir.resolve("in.txt");
    new DelimitedTextCodec().encode(record, input);

    int exitCode = new CommandLine(new CMD_convert()).execute(
        "-i", input.toString(), "-o", tempDir.resolve("out.nmr").toString());
    assertThat(exitCode).isEqualTo(2);
    assertThat(tempDir.resolve("out.nmr")).doesNotExist();
  }

  @Test
  public void testBadMetadataLiteralFails() {
    Path input = tempDir.resolve("in.txt");
    new DelimitedTextCodec().encode(record, input);

    int exitCode = new CommandLine(new CMD_convert()).execute(
        "-i", input.toString(), "-o", tempDir.resolve("out.h5").toString(),
        "--meta", "scans=(integer)many");
    assertThat(exitCode).isEqualTo(2);
  }
}
