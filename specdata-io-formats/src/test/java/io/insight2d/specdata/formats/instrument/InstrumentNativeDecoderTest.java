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

package io.insight2d.specdata.formats.instrument;

import io.insight2d.specdata.api.errors.FormatNotImplementedException;
import io.insight2d.specdata.api.services.SpectrumFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InstrumentNativeDecoderTest {

  @TempDir
  Path tempDir;

  @Test
  public void testDecodeIsNotImplemented() throws IOException {
    Path file = Files.write(tempDir.resolve("acq.fid"), new byte[]{1, 2, 3, 4});
    assertThatThrownBy(() -> new InstrumentNativeDecoder().decode(file))
        .isInstanceOf(FormatNotImplementedException.class)
        .satisfies(e -> {
          FormatNotImplementedException nie = (FormatNotImplementedException) e;
          assertThat(nie.getPath()).contains(file);
          assertThat(nie.getFormat()).contains(SpectrumFormat.instrument);
        });
  }
}
