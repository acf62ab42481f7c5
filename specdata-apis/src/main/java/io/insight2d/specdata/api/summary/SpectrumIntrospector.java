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

package io.insight2d.specdata.api.summary;

import io.insight2d.specdata.api.errors.EmptyRecordException;
import io.insight2d.specdata.api.record.SpectrumRecord;

/// Computes summary statistics over a spectrum record without modifying it.
///
/// NaN values are not skipped; a single NaN in the spectrum makes min, max, mean and std NaN.
public class SpectrumIntrospector {

  /// the element type tag of every spectrum record
  public static final String VALUE_TYPE = "float64";

  private SpectrumIntrospector() {
  }

  /// Summarize a record.
  /// @param record
  ///     the record
  /// @return the summary
  /// @throws EmptyRecordException
  ///     if the record has no rows or no columns
  public static SpectrumSummary summarize(SpectrumRecord record) {
    int rows = record.rows();
    int columns = record.columns();
    if (rows == 0 || columns == 0) {
      throw new EmptyRecordException(rows, columns);
    }

    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    double sum = 0.0d;
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < columns; j++) {
        double v = record.value(i, j);
        min = Math.min(min, v);
        max = Math.max(max, v);
        sum += v;
      }
    }
    long count = (long) rows * columns;
    double mean = sum / count;

    // second pass for the variance keeps precision when the mean is large
    double squares = 0.0d;
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < columns; j++) {
        double d = record.value(i, j) - mean;
        squares += d * d;
      }
    }
    double std = Math.sqrt(squares / count);

    return new SpectrumSummary(
        rows,
        columns,
        VALUE_TYPE,
        min,
        max,
        mean,
        std,
        rangeOf(record.axisF1()),
        rangeOf(record.axisF2()),
        record.metadata()
    );
  }

  private static AxisRange rangeOf(double[] axis) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double v : axis) {
      min = Math.min(min, v);
      max = Math.max(max, v);
    }
    return new AxisRange(min, max);
  }
}
