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

package io.insight2d.specdata.api.record;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// The canonical in-memory form of a two-dimensional spectrum: a `(rows, columns)` matrix of
/// doubles, one frequency axis per dimension, and an opaque metadata map.
///
/// The shape is fixed at construction:
/// - `rows` is the number of spectrum rows, and `axisF1` has exactly that many values
/// - `columns` is the length of `axisF2`, and every spectrum row has exactly that many values
/// - metadata is never null
///
/// The record owns its arrays exclusively. Constructor inputs are copied, and every accessor which
/// returns an array returns a copy. Values may be edited in place through
/// [#setValue(int, int, double)]; the shape may not.
public final class SpectrumRecord {

  private final double[][] spectrum;
  private final double[] axisF1;
  private final double[] axisF2;
  private final Map<String, MetaValue> metadata;

  /// create a spectrum record
  /// @param spectrum
  ///     the spectrum matrix, indexed `[f1][f2]`
  /// @param axisF1
  ///     the f1 axis, one value per row
  /// @param axisF2
  ///     the f2 axis, one value per column
  /// @param metadata
  ///     the metadata, or null for none
  /// @throws IllegalArgumentException
  ///     if the axis lengths do not match the matrix shape, or rows are ragged
  public SpectrumRecord(
      double[][] spectrum,
      double[] axisF1,
      double[] axisF2,
      Map<String, MetaValue> metadata
  )
  {
    Objects.requireNonNull(spectrum, "spectrum");
    Objects.requireNonNull(axisF1, "axisF1");
    Objects.requireNonNull(axisF2, "axisF2");
    if (axisF1.length != spectrum.length) {
      throw new IllegalArgumentException(
          "f1 axis has " + axisF1.length + " values but the spectrum has " + spectrum.length
          + " rows");
    }
    this.spectrum = new double[spectrum.length][];
    for (int i = 0; i < spectrum.length; i++) {
      double[] row = Objects.requireNonNull(spectrum[i], "spectrum row " + i);
      if (row.length != axisF2.length) {
        throw new IllegalArgumentException(
            "spectrum row " + i + " has " + row.length + " values but the f2 axis has "
            + axisF2.length);
      }
      this.spectrum[i] = Arrays.copyOf(row, row.length);
    }
    this.axisF1 = Arrays.copyOf(axisF1, axisF1.length);
    this.axisF2 = Arrays.copyOf(axisF2, axisF2.length);
    this.metadata = new LinkedHashMap<>();
    if (metadata != null) {
      metadata.forEach((k, v) -> this.metadata.put(
          Objects.requireNonNull(k, "metadata key"),
          Objects.requireNonNull(v, "metadata value for " + k)
      ));
    }
  }

  /// create a spectrum record without metadata
  /// @param spectrum
  ///     the spectrum matrix, indexed `[f1][f2]`
  /// @param axisF1
  ///     the f1 axis
  /// @param axisF2
  ///     the f2 axis
  public SpectrumRecord(double[][] spectrum, double[] axisF1, double[] axisF2) {
    this(spectrum, axisF1, axisF2, Map.of());
  }

  /// @return the number of points along f1
  public int rows() {
    return spectrum.length;
  }

  /// @return the number of points along f2
  public int columns() {
    return axisF2.length;
  }

  /// @return `{rows, columns}`
  public int[] shape() {
    return new int[]{rows(), columns()};
  }

  public double value(int row, int column) {
    return spectrum[row][column];
  }

  public void setValue(int row, int column, double value) {
    spectrum[row][column] = value;
  }

  /// @param row
  ///     the f1 index
  /// @return a copy of one spectrum row
  public double[] row(int row) {
    return Arrays.copyOf(spectrum[row], spectrum[row].length);
  }

  /// @return a deep copy of the spectrum matrix
  public double[][] spectrum() {
    double[][] copy = new double[spectrum.length][];
    for (int i = 0; i < spectrum.length; i++) {
      copy[i] = Arrays.copyOf(spectrum[i], spectrum[i].length);
    }
    return copy;
  }

  /// @return a copy of the f1 axis
  public double[] axisF1() {
    return Arrays.copyOf(axisF1, axisF1.length);
  }

  /// @return a copy of the f2 axis
  public double[] axisF2() {
    return Arrays.copyOf(axisF2, axisF2.length);
  }

  /// @return an unmodifiable view of the metadata, in insertion order
  public Map<String, MetaValue> metadata() {
    return Collections.unmodifiableMap(metadata);
  }

  /// Create a new record with the same data and the given metadata entries added to (or
  /// replacing) the existing ones.
  /// @param entries
  ///     the entries to add
  /// @return a new record
  public SpectrumRecord withMetadata(Map<String, MetaValue> entries) {
    Map<String, MetaValue> merged = new LinkedHashMap<>(metadata);
    merged.putAll(entries);
    return new SpectrumRecord(spectrum, axisF1, axisF2, merged);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SpectrumRecord)) return false;
    SpectrumRecord that = (SpectrumRecord) o;
    return Arrays.deepEquals(spectrum, that.spectrum) && Arrays.equals(axisF1, that.axisF1)
           && Arrays.equals(axisF2, that.axisF2) && metadata.equals(that.metadata);
  }

  @Override
  public int hashCode() {
    int result = Arrays.deepHashCode(spectrum);
    result = 31 * result + Arrays.hashCode(axisF1);
    result = 31 * result + Arrays.hashCode(axisF2);
    result = 31 * result + metadata.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "SpectrumRecord{shape=(" + rows() + ", " + columns() + "), metadata=" + metadata + "}";
  }
}
