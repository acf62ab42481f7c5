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

import io.insight2d.specdata.api.record.SpectrumRecord;

import java.nio.file.Path;

/// Reads one file of a specific format into a [SpectrumRecord].
///
/// Implementations are discovered with [java.util.ServiceLoader] and must be annotated with
/// [io.insight2d.specdata.api.services.Format]. They must be stateless, since a single instance
/// serves every decode call for its format.
public interface SpectrumDecoder {

  /// Decode a file. The file exists and carries an extension of this decoder's format.
  /// Every handle opened is closed before this method returns, on every path.
  /// @param path
  ///     the file to read
  /// @return a fully populated record
  /// @throws io.insight2d.specdata.api.errors.SpectrumDataException
  ///     or one of its subtypes, if the file cannot be decoded
  SpectrumRecord decode(Path path);
}
