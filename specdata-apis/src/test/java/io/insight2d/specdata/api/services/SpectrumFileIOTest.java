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

package io.insight2d.specdata.api.services;

import io.insight2d.specdata.api.errors.SpectrumFileNotFoundException;
import io.insight2d.specdata.api.errors.UnsupportedFormatException;
import io.insight2d.specdata.api.record.SpectrumRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SpectrumFileIOTest {

  @TempDir
  Path tempDir;

  private MockCsvCodec codec;
  private SpectrumFileIO io;

  @BeforeEach
  public void setUp() {
    codec = new MockCsvCodec();
    io = new SpectrumFileIO(new SpectrumCodecRegistry(List.of(codec)));
  }

  @Test
  public void testDecodeDispatchesByExtension() throws IOException {
    Path file = Files.writeString(tempDir.resolve("peaks.csv"), ",0\n0,1\n");
    SpectrumRecord record = io.decode(file);
    assertThat(codec.getDecoded()).containsExactly(file);
    assertThat(record.metadata().get("source").asText()).isEqualTo(file.toString());
  }

  @Test
  public void testMissingFileFailsBeforeFormatLookup() {
    Path missing = tempDir.resolve("missing.xyz");
    assertThatThrownBy(() -> io.decode(missing))
        .isInstanceOf(SpectrumFileNotFoundException.class)
        .satisfies(e -> assertThat(((SpectrumFileNotFoundException) e).getPath()).contains(missing));
    assertThat(codec.getDecoded()).isEmpty();
  }

  @Test
  public void testUnregisteredExtensionIsUnsupported() throws IOException {
    Path file = Files.writeString(tempDir.resolve("data.xyz"), "1 2 3\n");
    assertThatThrownBy(() -> io.decode(file))
        .isInstanceOf(UnsupportedFormatException.class)
        .satisfies(e -> assertThat(((UnsupportedFormatException) e).getIdentifier()).isEqualTo(".xyz"));
  }

  @Test
  public void testExtensionMatchIsCaseSensitive() throws IOException {
    Path file = Files.writeString(tempDir.resolve("data.CSV"), ",0\n0,1\n");
    assertThatThrownBy(() -> io.decode(file)).isInstanceOf(UnsupportedFormatException.class);
    assertThat(codec.getDecoded()).isEmpty();
  }

  @Test
  public void testFileWithoutExtensionIsUnsupported() throws IOException {
    Path file = Files.writeString(tempDir.resolve("spectrum"), "1\n");
    assertThatThrownBy(() -> io.decode(file)).isInstanceOf(UnsupportedFormatException.class);
  }

  @Test
  public void testRegisteredFormatWithoutDecoderIsUnsupported() throws IOException {
    Path file = Files.writeString(tempDir.resolve("data.h5"), "");
    assertThatThrownBy(() -> io.decode(file))
        .isInstanceOf(UnsupportedFormatException.class)
        .hasMessageContaining("hdf5");
  }

  @Test
  public void testEncodeSelectsEncoder() {
    SpectrumRecord record = new SpectrumRecord(new double[][]{{1.0d}}, new double[]{0}, new double[]{0});
    Path out = tempDir.resolve("out.csv");
    io.encode(record, SpectrumFormat.csv, out);
    io.encode(record, "csv", out);
    io.encode(record, out);
    assertThat(codec.getEncoded()).containsExactly(out, out, out);
  }

  @Test
  public void testEncodeWithoutEncoderIsUnsupported() {
    SpectrumRecord record = new SpectrumRecord(new double[][]{{1.0d}}, new double[]{0}, new double[]{0});
    assertThatThrownBy(() -> io.encode(record, SpectrumFormat.instrument, tempDir.resolve("x.nmr")))
        .isInstanceOf(UnsupportedFormatException.class);
    assertThatThrownBy(() -> io.encode(record, "xyz", tempDir.resolve("x.xyz")))
        .isInstanceOf(UnsupportedFormatException.class);
  }
}
