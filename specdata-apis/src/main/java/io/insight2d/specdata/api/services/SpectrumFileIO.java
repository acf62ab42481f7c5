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
import io.insight2d.specdata.api.fileio.SpectrumDecoder;
import io.insight2d.specdata.api.fileio.SpectrumEncoder;
import io.insight2d.specdata.api.record.SpectrumRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// The entry point for reading and writing spectrum files.
///
/// Dispatch is by file extension for decoding, and by [SpectrumFormat] (or destination extension)
/// for encoding. All I/O happens inside the selected codec.
///
/// ```java
/// SpectrumFileIO io = SpectrumFileIO.defaults();
/// SpectrumRecord record = io.decode(Path.of("noesy.csv"));
/// io.encode(record, SpectrumFormat.hdf5, Path.of("noesy.h5"));
/// ```
public class SpectrumFileIO {
  private static final Logger logger = LogManager.getLogger(SpectrumFileIO.class);

  private final SpectrumCodecRegistry registry;

  /// create a dispatcher over a specific registry
  /// @param registry
  ///     the codecs to dispatch to
  public SpectrumFileIO(SpectrumCodecRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  private static final class DefaultHolder {
    private static final SpectrumFileIO INSTANCE = new SpectrumFileIO(SpectrumCodecRegistry.load());
  }

  /// @return the shared dispatcher over all codecs found by [java.util.ServiceLoader]
  public static SpectrumFileIO defaults() {
    return DefaultHolder.INSTANCE;
  }

  /// @return the registry this dispatcher uses
  public SpectrumCodecRegistry getRegistry() {
    return registry;
  }

  /// Decode a spectrum file.
  /// @param path
  ///     the file to read
  /// @return the decoded record
  /// @throws SpectrumFileNotFoundException
  ///     if the path does not exist; checked before the format is looked up
  /// @throws UnsupportedFormatException
  ///     if the extension is not registered, or its format has no decoder
  public SpectrumRecord decode(Path path) {
    if (!Files.exists(path)) {
      throw new SpectrumFileNotFoundException(path);
    }
    SpectrumFormat format = formatOf(path);
    SpectrumDecoder decoder = registry.decoderFor(format)
        .orElseThrow(() -> new UnsupportedFormatException(format, "decode", path));
    logger.debug("decoding {} as {}", path, format);
    return decoder.decode(path);
  }

  /// Encode a record in the given format.
  /// @param record
  ///     the record to write
  /// @param format
  ///     the target format
  /// @param path
  ///     the destination file
  /// @throws UnsupportedFormatException
  ///     if the format has no encoder
  public void encode(SpectrumRecord record, SpectrumFormat format, Path path) {
    Objects.requireNonNull(record, "record");
    SpectrumEncoder encoder = registry.encoderFor(format)
        .orElseThrow(() -> new UnsupportedFormatException(format, "encode", path));
    logger.debug("encoding {} to {} as {}", record, path, format);
    encoder.encode(record, path);
  }

  /// Encode a record in the given format.
  /// @param record
  ///     the record to write
  /// @param formatName
  ///     a format name or extension, as accepted by [SpectrumFormat#fromName(String)]
  /// @param path
  ///     the destination file
  public void encode(SpectrumRecord record, String formatName, Path path) {
    encode(record, SpectrumFormat.fromName(formatName), path);
  }

  /// Encode a record in the format implied by the destination extension.
  /// @param record
  ///     the record to write
  /// @param path
  ///     the destination file
  public void encode(SpectrumRecord record, Path path) {
    encode(record, formatOf(path), path);
  }

  private static SpectrumFormat formatOf(Path path) {
    String extension = SpectrumFormat.extensionOf(path).orElse("");
    return SpectrumFormat.fromExtension(extension)
        .orElseThrow(() -> new UnsupportedFormatException(extension, path));
  }
}
