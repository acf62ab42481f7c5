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

/// Thrown when a file extension or format identifier is not registered, or when a registered
/// format has no codec for the requested direction.
public class UnsupportedFormatException extends SpectrumDataException {

  private final String identifier;

  /// an extension or identifier which is not part of the registered set
  /// @param identifier
  ///     the rejected extension or format name
  /// @param path
  ///     the file concerned, or null
  public UnsupportedFormatException(String identifier, Path path) {
    super("Unsupported file format: '" + identifier + "'" + (path != null ? " (" + path + ")" : ""),
        path, null);
    this.identifier = identifier;
  }

  /// a registered format which has no codec for the requested operation
  /// @param format
  ///     the format
  /// @param operation
  ///     either "decode" or "encode"
  /// @param path
  ///     the file concerned, or null
  public UnsupportedFormatException(SpectrumFormat format, String operation, Path path) {
    super("No " + operation + "r is available for format " + format.name()
          + (path != null ? " (" + path + ")" : ""), path, format);
    this.identifier = format.name();
  }

  /// @return the rejected extension or format identifier
  public String getIdentifier() {
    return identifier;
  }
}
