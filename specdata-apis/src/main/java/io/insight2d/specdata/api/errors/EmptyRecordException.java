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

/// Thrown when introspection is asked to summarize a record with no rows or no columns.
public class EmptyRecordException extends SpectrumDataException {

  private final int rows;
  private final int columns;

  public EmptyRecordException(int rows, int columns) {
    super(String.format("Cannot summarize an empty spectrum record of shape (%d, %d)", rows, columns),
        null, null);
    this.rows = rows;
    this.columns = columns;
  }

  public int getRows() {
    return rows;
  }

  public int getColumns() {
    return columns;
  }
}
