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

/// Thrown when a binary container lacks a required dataset, holds one with the wrong rank or
/// element type, or cannot be opened as a container at all.
public class MalformedContainerException extends SpectrumDataException {

  public MalformedContainerException(String message, Path path, Throwable cause) {
    super(message, path, SpectrumFormat.hdf5, cause);
  }

  public MalformedContainerException(String message, Path path) {
    this(message, path, null);
  }
}
