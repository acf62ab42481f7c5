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

/// Thrown when a metadata value cannot be represented, either by the metadata variant itself or
/// by the format a record is being encoded to.
public class UnsupportedMetadataTypeException extends SpectrumDataException {

  private final String key;
  private final String valueType;

  public UnsupportedMetadataTypeException(
      String key,
      String valueType,
      Path path,
      SpectrumFormat format
  )
  {
    super("Metadata entry '" + key + "' has unsupported value type " + valueType
          + (format != null ? " for format " + format.name() : "")
          + (path != null ? " (" + path + ")" : ""), path, format);
    this.key = key;
    this.valueType = valueType;
  }

  public UnsupportedMetadataTypeException(String key, String valueType) {
    this(key, valueType, null, null);
  }

  public String getKey() {
    return key;
  }

  public String getValueType() {
    return valueType;
  }
}
