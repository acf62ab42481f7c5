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

/// Thrown by a registered decoder which has no real parser for its format yet.
public class FormatNotImplementedException extends SpectrumDataException {

  public FormatNotImplementedException(Path path, SpectrumFormat format, String detail) {
    super("Decoding " + format.name() + " files is not yet available (" + detail + "): " + path,
        path, format);
  }
}
