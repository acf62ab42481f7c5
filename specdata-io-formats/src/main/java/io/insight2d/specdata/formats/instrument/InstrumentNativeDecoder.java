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

package io.insight2d.specdata.formats.instrument;

import com.google.auto.service.AutoService;
import io.insight2d.specdata.api.errors.FormatNotImplementedException;
import io.insight2d.specdata.api.fileio.SpectrumDecoder;
import io.insight2d.specdata.api.record.SpectrumRecord;
import io.insight2d.specdata.api.services.Format;
import io.insight2d.specdata.api.services.SpectrumFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/// Claims the `.nmr` and `.fid` extensions so that vendor acquisition files are recognized.
/// Reading them needs a vendor-specific reader, which is not available yet; every decode fails
/// with [FormatNotImplementedException]. There is no encoder for this format.
@AutoService(SpectrumDecoder.class)
@Format(SpectrumFormat.instrument)
public class InstrumentNativeDecoder implements SpectrumDecoder {
  private static final Logger logger = LogManager.getLogger(InstrumentNativeDecoder.class);

  @Override
  public SpectrumRecord decode(Path path) {
    logger.debug("refusing instrument-native file {}", path);
    throw new FormatNotImplementedException(
        path, SpectrumFormat.instrument, "vendor acquisition files need a vendor reader");
  }
}
