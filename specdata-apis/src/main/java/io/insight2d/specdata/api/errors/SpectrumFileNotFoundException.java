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

import java.nio.file.Path;

/// Thrown when a path given for decoding does not exist. This is checked before any format lookup.
public class SpectrumFileNotFoundException extends SpectrumDataException {

  public SpectrumFileNotFoundException(Path path) {
    super("File not found: " + path, path, null);
  }
}
