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
import java.util.OptionalInt;

/// Thrown when text content cannot be parsed into a rectangular numeric matrix with the
/// expected layout.
public class SpectrumParseException extends SpectrumDataException {

  private final int lineNumber;

  /// create a parse failure at a known line
  /// @param message
  ///     a description of the failure
  /// @param path
  ///     the file being parsed
  /// @param format
  ///     the format being parsed
  /// @param lineNumber
  ///     the 1-based line number, or -1 when not applicable
  /// @param cause
  ///     the underlying parse failure, or null
  public SpectrumParseException(
      String message,
      Path path,
      SpectrumFormat format,
      int lineNumber,
      Throwable cause
  )
  {
    super(lineNumber > 0 ? message + " at line " + lineNumber + " of " + path : message + ": " + path,
        path, format, cause);
    this.lineNumber = lineNumber;
  }

  public SpectrumParseException(String message, Path path, SpectrumFormat format, Throwable cause) {
    this(message, path, format, -1, cause);
  }

  /// @return the 1-based line number of the failure, when known
  public OptionalInt getLineNumber() {
    return lineNumber > 0 ? OptionalInt.of(lineNumber) : OptionalInt.empty();
  }
}
