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

package io.insight2d.specdata.api.fileio;

import io.insight2d.specdata.api.errors.SpectrumDataException;
import io.insight2d.specdata.api.services.SpectrumFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FileOutputsTest {

  @TempDir
  Path tempDir;

  @Test
  public void testReplacesExistingFile() throws IOException {
    Path target = Files.writeString(tempDir.resolve("out.txt"), "old");
    FileOutputs.writeReplacing(target, SpectrumFormat.text, p -> Files.writeString(p, "new"));
    assertThat(target).hasContent("new");
    assertThat(listing()).containsExactly(target);
  }

  @Test
  public void testCreatesParentDirectories() {
    Path target = tempDir.resolve("a/b/out.txt");
    FileOutputs.writeReplacing(target, SpectrumFormat.text, p -> Files.writeString(p, "x"));
    assertThat(target).hasContent("x");
  }

  @Test
  public void testFailedWriteLeavesNoPartialFile() throws IOException {
    Path target = Files.writeString(tempDir.resolve("out.txt"), "old");
    assertThatThrownBy(() -> FileOutputs.writeReplacing(target, SpectrumFormat.text, p -> {
      Files.writeString(p, "partial");
      throw new IOException("disk full");
    }))
        .isInstanceOf(SpectrumDataException.class)
        .hasMessageContaining("disk full")
        .hasCauseInstanceOf(IOException.class);
    assertThat(target).hasContent("old");
    assertThat(listing()).containsExactly(target);
  }

  @Test
  public void testRuntimeFailurePropagatesUnchanged() {
    Path target = tempDir.resolve("out.txt");
    IllegalStateException failure = new IllegalStateException("bad record");
    assertThatThrownBy(() -> FileOutputs.writeReplacing(target, SpectrumFormat.text, p -> {
      throw failure;
    })).isSameAs(failure);
    assertThat(target).doesNotExist();
  }

  private java.util.List<Path> listing() throws IOException {
    try (Stream<Path> files = Files.list(tempDir)) {
      return files.toList();
    }
  }
}
