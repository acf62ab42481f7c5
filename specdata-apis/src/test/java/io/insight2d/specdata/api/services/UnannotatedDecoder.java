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

import io.insight2d.specdata.api.fileio.SpectrumDecoder;
import io.insight2d.specdata.api.record.SpectrumRecord;

import java.nio.file.Path;

/// A decoder without a format annotation, which the registry must refuse or skip.
public class UnannotatedDecoder implements SpectrumDecoder {

  @Override
  public SpectrumRecord decode(Path path) {
    throw new UnsupportedOperationException("never dispatched");
  }
}
