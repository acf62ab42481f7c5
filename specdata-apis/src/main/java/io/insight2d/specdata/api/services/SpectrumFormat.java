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

import io.insight2d.specdata.api.errors.UnsupportedFormatException;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/// The closed set of spectrum file formats, with the file extensions registered for each.
/// Extension matching is case-sensitive.
public enum SpectrumFormat {
  /// HDF5 binary container holding the spectrum, both axes and root attributes
  hdf5(".h5"),
  /// whitespace-delimited numeric matrix, with an optional JSON metadata sidecar
  text(".txt", ".dat"),
  /// comma separated values with the f2 axis as header and the f1 axis as index column
  csv(".csv"),
  /// vendor acquisition files
  instrument(".nmr", ".fid");

  private final String[] extensions;

  SpectrumFormat(String... extensions) {
    this.extensions = extensions;
  }

  /// @return the primary extension, including the leading dot
  public String getExtension() {
    return extensions[0];
  }

  /// @return all registered extensions, including the leading dot
  public String[] getExtensions() {
    return Arrays.copyOf(extensions, extensions.length);
  }

  /// @return every extension registered for any format
  public static Set<String> getAllExtensions() {
    return Arrays.stream(values())
        .flatMap(f -> Arrays.stream(f.extensions))
        .collect(Collectors.toSet());
  }

  /// Find the format registered for an extension.
  /// @param extension
  ///     an extension, with or without the leading dot
  /// @return the matching format, if any
  public static Optional<SpectrumFormat> fromExtension(String extension) {
    String normalized = extension.startsWith(".") ? extension : "." + extension;
    return Arrays.stream(values())
        .filter(f -> Arrays.asList(f.extensions).contains(normalized))
        .findFirst();
  }

  /// Find the format for a path by its extension.
  /// @param path
  ///     the path
  /// @return the matching format, if any
  public static Optional<SpectrumFormat> fromPath(Path path) {
    return extensionOf(path).flatMap(SpectrumFormat::fromExtension);
  }

  /// Resolve a format identifier, which may be a format name (`hdf5`) or one of its extensions
  /// with or without the leading dot (`h5`, `.txt`).
  /// @param identifier
  ///     the identifier
  /// @return the format
  /// @throws UnsupportedFormatException
  ///     if no format matches
  public static SpectrumFormat fromName(String identifier) {
    for (SpectrumFormat format : values()) {
      if (format.name().equals(identifier)) {
        return format;
      }
    }
    return fromExtension(identifier)
        .orElseThrow(() -> new UnsupportedFormatException(identifier, null));
  }

  /// @param path
  ///     a path
  /// @return the extension of the file name, including the dot, if it has one
  public static Optional<String> extensionOf(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return Optional.empty();
    }
    String name = fileName.toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? Optional.of(name.substring(dot)) : Optional.empty();
  }
}
