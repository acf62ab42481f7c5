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

package io.insight2d.specdata.api.errors;

import io.insight2d.specdata.api.services.SpectrumFormat;

import java.nio.file.Path;
import java.util.Optional;

/// Base type for every failure raised while decoding, encoding or inspecting spectrum data.
///
/// Failures carry the path and format they concern, when those are known, and the underlying
/// cause. They are never converted into default or empty records.
public class SpectrumDataException extends RuntimeException {

  private final Path path;
  private final SpectrumFormat format;

  /// create a spectrum data failure
  /// @param message
  ///     a description of the failure
  /// @param path
  ///     the file concerned, or null
  /// @param format
  ///     the format concerned, or null
  /// @param cause
  ///     the underlying cause, or null
  public SpectrumDataException(String message, Path path, SpectrumFormat format, Throwable cause) {
    super(message, cause);
    this.path = path;
    this.format = format;
  }

  /// create a spectrum data failure without an underlying cause
  /// @param message
  ///     a description of the failure
  /// @param path
  ///     the file concerned, or null
  /// @param format
  ///     the format concerned, or null
  public SpectrumDataException(String message, Path path, SpectrumFormat format) {
    this(message, path, format, null);
  }

  /// @return the file this failure concerns, if known
  public Optional<Path> getPath() {
    return Optional.ofNullable(path);
  }

  /// @return the format this failure concerns, if known
  public Optional<SpectrumFormat> getFormat() {
    return Optional.ofNullable(format);
  }
}
