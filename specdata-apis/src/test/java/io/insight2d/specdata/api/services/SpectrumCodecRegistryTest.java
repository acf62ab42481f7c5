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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Tests for codec registration. The ServiceLoader cases use the mock codec registered in the
/// test resources of this module.
public class SpectrumCodecRegistryTest {

  @Test
  public void testServiceLoaderFindsAnnotatedCodecs() {
    SpectrumCodecRegistry registry = SpectrumCodecRegistry.load();
    assertThat(registry.decodableFormats()).containsExactly(SpectrumFormat.csv);
    assertThat(registry.encodableFormats()).containsExactly(SpectrumFormat.csv);
    assertThat(registry.decoderFor(SpectrumFormat.csv)).containsInstanceOf(MockCsvCodec.class);
    assertThat(registry.decoderFor(SpectrumFormat.hdf5)).isEmpty();
  }

  @Test
  public void testCodecImplementingBothDirectionsIsOneInstance() {
    MockCsvCodec codec = new MockCsvCodec();
    SpectrumCodecRegistry registry = new SpectrumCodecRegistry(List.of(codec));
    assertThat(registry.decoderFor(SpectrumFormat.csv)).containsSame(codec);
    assertThat(registry.encoderFor(SpectrumFormat.csv)).containsSame(codec);
  }

  @Test
  public void testUnannotatedCodecIsRejected() {
    assertThatThrownBy(() -> new SpectrumCodecRegistry(List.of(new UnannotatedDecoder())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("@Format");
  }

  @Test
  public void testNonCodecIsRejected() {
    assertThatThrownBy(() -> new SpectrumCodecRegistry(List.of("not a codec")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testFormatSetsAreReadOnly() {
    SpectrumCodecRegistry registry = new SpectrumCodecRegistry(List.of(new MockCsvCodec()));
    assertThatThrownBy(() -> registry.decodableFormats().add(SpectrumFormat.hdf5))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
