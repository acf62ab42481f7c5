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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/// Helpers for writing encoder output so that a failed encode never leaves a partial file.
public class FileOutputs {
  private static final Logger logger = LogManager.getLogger(FileOutputs.class);

  private FileOutputs() {
  }

  /// A write action against a temporary file.
  @FunctionalInterface
  public interface PathWriter {
    /// @param path
    ///     the file to write
    /// @throws IOException
    ///     if the write fails
    void write(Path path) throws IOException;
  }

  /// Write a file by way of a temporary sibling, then move it over the destination.
  /// On any failure the temporary file is removed and the destination is left untouched.
  /// @param target
  ///     the destination file
  /// @param format
  ///     the format being written, for error reporting
  /// @param writer
  ///     the action which writes the temporary file
  public static void writeReplacing(Path target, SpectrumFormat format, PathWriter writer) {
    Path absolute = target.toAbsolutePath();
    Path dir = absolute.getParent();
    Path tempFile = null;
    try {
      if (dir != null) {
        Files.createDirectories(dir);
      }
      tempFile = Files.createTempFile(dir, "." + absolute.getFileName() + ".", ".tmp");
      writer.write(tempFile);
      moveReplacing(tempFile, absolute);
      logger.debug("wrote {} as {}", absolute, format);
    } catch (IOException e) {
      removeTempFile(tempFile, e);
      throw new SpectrumDataException(
          "Failed to write " + format + " file: " + e.getMessage(), target, format, e);
    } catch (RuntimeException e) {
      removeTempFile(tempFile, e);
      throw e;
    }
  }

  private static void moveReplacing(Path from, Path to) throws IOException {
    try {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void removeTempFile(Path tempFile, Exception primary) {
    if (tempFile == null) {
      return;
    }
    try {
      Files.deleteIfExists(tempFile);
    } catch (IOException e) {
      primary.addSuppressed(e);
    }
  }
}
