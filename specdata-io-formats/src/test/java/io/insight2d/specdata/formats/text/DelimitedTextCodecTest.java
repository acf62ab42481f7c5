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

import io.insight2d.specdata.api.errors.SpectrumParseException;
import io.insight2d.specdata.api.errors.UnsupportedMetadataTypeException;
import io.insight2d.specdata.api.record.MetaValue;
import io.insight2d.specdata.api.record.SpectrumRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DelimitedTextCodecTest {

  @TempDir
  Path tempDir;

  private final DelimitedTextCodec codec = new DelimitedTextCodec();

  @Test
  public void testSpectrumSurvivesButAxesAreRegenerated() {
    double[][] matrix = {{0.1, 2.0, -3.5}, {1.0e-12, 5.0, 1.0 / 3.0}};
    SpectrumRecord record = new SpectrumRecord(
        matrix, new double[]{100.0, 200.0}, new double[]{7.0, 8.0, 9.0});
    Path file = tempDir.resolve("spectrum.txt");

    codec.encode(record, file);
    SpectrumRecord decoded = codec.decode(file);

    assertThat(decoded.spectrum()).isDeepEqualTo(matrix);
    assertThat(decoded.axisF1()).containsExactly(0.0, 12.0);
    assertThat(decoded.axisF2()).containsExactly(0.0, 6.0, 12.0);
    assertThat(decoded.axisF1()).isNotEqualTo(record.axisF1());
    assertThat(decoded.metadata()).isEmpty();
    assertThat(DelimitedTextCodec.sidecarFor(file)).doesNotExist();
  }

  @Test
  public void testMetadataRoundTripsThroughSidecar() {
    Map<String, MetaValue> meta = new LinkedHashMap<>();
    meta.put("scans", MetaValue.of(16L));
    meta.put("frequency", MetaValue.of(600.13d));
    meta.put("solvent", MetaValue.of("D2O"));
    meta.put("phased", MetaValue.of(true));
    SpectrumRecord record = new SpectrumRecord(
        new double[][]{{1, 2}}, new double[]{0}, new double[]{0, 12}, meta);
    Path file = tempDir.resolve("meta.dat");

    codec.encode(record, file);
    assertThat(tempDir.resolve("meta.json")).exists();
    SpectrumRecord decoded = codec.decode(file);
    assertThat(decoded.metadata()).isEqualTo(meta);
  }

  @Test
  public void testEncodingWithoutMetadataRemovesStaleSidecar() throws IOException {
    Path file = tempDir.resolve("stale.txt");
    Path sidecar = Files.writeString(tempDir.resolve("stale.json"), "{\"old\": 1}");
    codec.encode(new SpectrumRecord(new double[][]{{1}}, new double[]{0}, new double[]{0}), file);
    assertThat(sidecar).doesNotExist();
  }

  @Test
  public void testCommentsBlankLinesAndSpecialTokens() throws IOException {
    Path file = Files.writeString(tempDir.resolve("special.txt"),
        "# exported spectrum\n\n1.0\tnan   inf\n  -INF 2 3e2\n\n");
    SpectrumRecord record = codec.decode(file);
    assertThat(record.shape()).containsExactly(2, 3);
    assertThat(record.value(0, 1)).isNaN();
    assertThat(record.value(0, 2)).isEqualTo(Double.POSITIVE_INFINITY);
    assertThat(record.value(1, 0)).isEqualTo(Double.NEGATIVE_INFINITY);
    assertThat(record.value(1, 2)).isEqualTo(300.0);
  }

  @Test
  public void testRaggedRowsFail() throws IOException {
    Path file = Files.writeString(tempDir.resolve("ragged.txt"), "1 2 3\n4 5\n");
    assertThatThrownBy(() -> codec.decode(file))
        .isInstanceOf(SpectrumParseException.class)
        .satisfies(e -> assertThat(((SpectrumParseException) e).getLineNumber()).hasValue(2));
  }

  @Test
  public void testNonNumericTokenFails() throws IOException {
    Path file = Files.writeString(tempDir.resolve("words.txt"), "1 2\n3 four\n");
    assertThatThrownBy(() -> codec.decode(file))
        .isInstanceOf(SpectrumParseException.class)
        .hasMessageContaining("four")
        .hasCauseInstanceOf(NumberFormatException.class);
  }

  @Test
  public void testFileWithoutDataFails() throws IOException {
    Path file = Files.writeString(tempDir.resolve("empty.txt"), "# nothing here\n\n");
    assertThatThrownBy(() -> codec.decode(file)).isInstanceOf(SpectrumParseException.class);
  }

  @Test
  public void testNestedSidecarValueIsUnsupported() throws IOException {
    Path file = Files.writeString(tempDir.resolve("nested.txt"), "1 2\n");
    Files.writeString(tempDir.resolve("nested.json"), "{\"probe\": {\"id\": 5}}");
    assertThatThrownBy(() -> codec.decode(file))
        .isInstanceOf(UnsupportedMetadataTypeException.class)
        .satisfies(e -> assertThat(((UnsupportedMetadataTypeException) e).getKey())
            .isEqualTo("probe"));
  }

  @Test
  public void testInvalidSidecarIsParseError() throws IOException {
    Path file = Files.writeString(tempDir.resolve("broken.txt"), "1 2\n");
    Files.writeString(tempDir.resolve("broken.json"), "{\"scans\": }");
    assertThatThrownBy(() -> codec.decode(file)).isInstanceOf(SpectrumParseException.class);
  }

  @Test
  public void testNonFiniteRealMetadataIsRejectedBeforeWriting() {
    SpectrumRecord record = new SpectrumRecord(new double[][]{{1}}, new double[]{0},
        new double[]{0}, Map.of("offset", MetaValue.of(Double.NaN)));
    Path file = tempDir.resolve("nan.txt");
    assertThatThrownBy(() -> codec.encode(record, file))
        .isInstanceOf(UnsupportedMetadataTypeException.class);
    assertThat(file).doesNotExist();
  }

  @Test
  public void testLinspace() {
    assertThat(DelimitedTextCodec.linspace(0, 12, 5)).containsExactly(0.0, 3.0, 6.0, 9.0, 12.0);
    assertThat(DelimitedTextCodec.linspace(0, 12, 1)).containsExactly(0.0);
    assertThat(DelimitedTextCodec.linspace(0, 12, 0)).isEmpty();
  }

  @Test
  public void testSidecarNaming() {
    assertThat(DelimitedTextCodec.sidecarFor(Path.of("a", "b", "noesy.txt")))
        .isEqualTo(Path.of("a", "b", "noesy.json"));
    assertThat(DelimitedTextCodec.sidecarFor(Path.of("run.1.dat")))
        .isEqualTo(Path.of("run.1.json"));
  }
}
