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

package io.insight2d.specdata.formats.hdf5;

import com.google.auto.service.AutoService;
import io.insight2d.specdata.api.errors.MalformedContainerException;
import io.insight2d.specdata.api.errors.UnsupportedMetadataTypeException;
import io.insight2d.specdata.api.fileio.FileOutputs;
import io.insight2d.specdata.api.fileio.SpectrumDecoder;
import io.insight2d.specdata.api.fileio.SpectrumEncoder;
import io.insight2d.specdata.api.record.MetaType;
import io.insight2d.specdata.api.record.MetaValue;
import io.insight2d.specdata.api.record.SpectrumRecord;
import io.insight2d.specdata.api.services.Format;
import io.insight2d.specdata.api.services.SpectrumFormat;
import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/// Reads and writes spectrum records as HDF5 files.
///
/// Layout:
/// - `spectrum` - rank 2 dataset, `(n1, n2)`
/// - `frequencies_f1` - rank 1 dataset of length `n1`
/// - `frequencies_f2` - rank 1 dataset of length `n2`
/// - one root attribute per metadata entry
///
/// Integer, real, text and flag metadata can be stored. Text attributes are written as ASCII, so a
/// record carrying non-ASCII text is refused before the file is created.
@AutoService({SpectrumDecoder.class, SpectrumEncoder.class})
@Format(SpectrumFormat.hdf5)
public class Hdf5SpectrumCodec implements SpectrumDecoder, SpectrumEncoder {
  private static final Logger logger = LogManager.getLogger(Hdf5SpectrumCodec.class);

  public static final String SPECTRUM_DATASET = "spectrum";
  public static final String F1_DATASET = "frequencies_f1";
  public static final String F2_DATASET = "frequencies_f2";
  /// root attribute jhdf adds to every file it writes; not user metadata
  public static final String WRITER_ATTRIBUTE = "_jHDF";

  @Override
  public SpectrumRecord decode(Path path) {
    try (HdfFile hdfFile = new HdfFile(path)) {
      Dataset spectrumDs = requireDataset(hdfFile, SPECTRUM_DATASET, 2, path);
      Dataset f1Ds = requireDataset(hdfFile, F1_DATASET, 1, path);
      Dataset f2Ds = requireDataset(hdfFile, F2_DATASET, 1, path);

      int[] dims = spectrumDs.getDimensions();
      int rows = dims[0];
      int columns = dims[1];
      if (rows == 0 || columns == 0) {
        throw new MalformedContainerException(
            "dataset '" + SPECTRUM_DATASET + "' is empty " + Arrays.toString(dims), path);
      }

      double[] f1 = widen(f1Ds, path);
      double[] f2 = widen(f2Ds, path);
      if (f1.length != rows) {
        throw new MalformedContainerException(
            "dataset '" + F1_DATASET + "' has " + f1.length + " values for " + rows
            + " spectrum rows", path);
      }
      if (f2.length != columns) {
        throw new MalformedContainerException(
            "dataset '" + F2_DATASET + "' has " + f2.length + " values for " + columns
            + " spectrum columns", path);
      }

      double[] flat = widen(spectrumDs, path);
      double[][] spectrum = new double[rows][];
      for (int i = 0; i < rows; i++) {
        spectrum[i] = Arrays.copyOfRange(flat, i * columns, (i + 1) * columns);
      }

      Map<String, MetaValue> metadata = readAttributes(hdfFile.getAttributes(), path);
      logger.debug("read {}x{} spectrum with {} attributes from {}", rows, columns,
          metadata.size(), path);
      return new SpectrumRecord(spectrum, f1, f2, metadata);
    } catch (HdfException e) {
      throw new MalformedContainerException("not a readable HDF5 file: " + e.getMessage(), path, e);
    }
  }

  @Override
  public void encode(SpectrumRecord record, Path path) {
    Map<String, MetaValue> metadata = record.metadata();
    metadata.forEach((key, value) -> {
      if (value.type() == MetaType.TEXT && !isAscii(value.asText())) {
        throw new UnsupportedMetadataTypeException(
            key, "non-ASCII TEXT", path, SpectrumFormat.hdf5);
      }
    });

    double[][] spectrum = record.spectrum();
    double[] f1 = record.axisF1();
    double[] f2 = record.axisF2();
    FileOutputs.writeReplacing(path, SpectrumFormat.hdf5, tempFile -> {
      try (WritableHdfFile writable = HdfFile.write(tempFile)) {
        writable.putDataset(SPECTRUM_DATASET, spectrum);
        writable.putDataset(F1_DATASET, f1);
        writable.putDataset(F2_DATASET, f2);
        metadata.forEach((key, value) -> writable.putAttribute(key, value.value()));
      }
    });
    logger.debug("wrote {}x{} spectrum with {} attributes to {}", record.rows(),
        record.columns(), metadata.size(), path);
  }

  private Dataset requireDataset(HdfFile hdfFile, String name, int rank, Path path) {
    Node node = hdfFile.getChildren().get(name);
    if (node == null) {
      throw new MalformedContainerException("missing dataset '" + name + "'", path);
    }
    if (!(node instanceof Dataset dataset)) {
      throw new MalformedContainerException("'" + name + "' is not a dataset", path);
    }
    int[] dims = dataset.getDimensions();
    if (dims.length != rank) {
      throw new MalformedContainerException(
          "dataset '" + name + "' has rank " + dims.length + ", expected " + rank, path);
    }
    return dataset;
  }

  /// Flatten a numeric dataset into doubles, widening narrower element types.
  private double[] widen(Dataset dataset, Path path) {
    Object flat = dataset.getDataFlat();
    if (flat instanceof double[] doubles) {
      return doubles;
    }
    double[] out;
    if (flat instanceof float[] floats) {
      out = new double[floats.length];
      for (int i = 0; i < floats.length; i++) {
        out[i] = floats[i];
      }
    } else if (flat instanceof long[] longs) {
      out = new double[longs.length];
      for (int i = 0; i < longs.length; i++) {
        out[i] = longs[i];
      }
    } else if (flat instanceof int[] ints) {
      out = new double[ints.length];
      for (int i = 0; i < ints.length; i++) {
        out[i] = ints[i];
      }
    } else if (flat instanceof short[] shorts) {
      out = new double[shorts.length];
      for (int i = 0; i < shorts.length; i++) {
        out[i] = shorts[i];
      }
    } else if (flat instanceof byte[] bytes) {
      out = new double[bytes.length];
      for (int i = 0; i < bytes.length; i++) {
        out[i] = bytes[i];
      }
    } else {
      throw new MalformedContainerException(
          "dataset '" + dataset.getName() + "' has non-numeric element type "
          + dataset.getJavaType().getSimpleName(), path);
    }
    logger.debug("widened {} values of dataset '{}' from {}", out.length, dataset.getName(),
        dataset.getJavaType().getSimpleName());
    return out;
  }

  private Map<String, MetaValue> readAttributes(Map<String, Attribute> attributes, Path path) {
    Map<String, MetaValue> metadata = new LinkedHashMap<>();
    for (Map.Entry<String, Attribute> entry : attributes.entrySet()) {
      String key = entry.getKey();
      if (WRITER_ATTRIBUTE.equals(key)) {
        continue;
      }
      Object data = entry.getValue().getData();
      if (data == null || data.getClass().isArray()) {
        throw new UnsupportedMetadataTypeException(
            key, data == null ? "empty" : data.getClass().getSimpleName(), path,
            SpectrumFormat.hdf5);
      }
      try {
        metadata.put(key, MetaValue.from(key, data));
      } catch (UnsupportedMetadataTypeException e) {
        throw new UnsupportedMetadataTypeException(
            e.getKey(), e.getValueType(), path, SpectrumFormat.hdf5);
      }
    }
    return metadata;
  }

  private static boolean isAscii(String text) {
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) > 0x7f) {
        return false;
      }
    }
    return true;
  }
}
