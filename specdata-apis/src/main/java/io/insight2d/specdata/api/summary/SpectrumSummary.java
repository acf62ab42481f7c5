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

import io.insight2d.specdata.api.record.MetaValue;

import java.util.Map;

/// Summary statistics of a spectrum record, as computed by [SpectrumIntrospector].
/// @param rows
///     the number of points along f1
/// @param columns
///     the number of points along f2
/// @param valueType
///     the numeric element type tag of the spectrum values
/// @param min
///     the smallest spectrum value
/// @param max
///     the largest spectrum value
/// @param mean
///     the arithmetic mean of all spectrum values
/// @param std
///     the population standard deviation of all spectrum values
/// @param f1Range
///     the range of the f1 axis
/// @param f2Range
///     the range of the f2 axis
/// @param metadata
///     the record metadata
public record SpectrumSummary(
    int rows,
    int columns,
    String valueType,
    double min,
    double max,
    double mean,
    double std,
    AxisRange f1Range,
    AxisRange f2Range,
    Map<String, MetaValue> metadata
)
{
  /// @return `{rows, columns}`
  public int[] shape() {
    return new int[]{rows, columns};
  }
}
