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

/// The closed set of value kinds a metadata entry may hold.
///
/// Literal forms accepted by [#fromLiteral(String)]:
/// - `42`, `-7`, `42L` - INTEGER
/// - `0.5`, `1e-3`, `0.5d` - REAL
/// - `true`, `false` - FLAG
///
/// Everything which does not match one of the above forms is taken as a TEXT value. A type can
/// also be forced with a prefix, as in `(text)42` or `(real)3`; see [MetaValue#parse(String)].
public enum MetaType {
  INTEGER(Long.class) {
    @Override
    public Long parse(String value) {
      return Long.parseLong(
          value.endsWith("L") || value.endsWith("l") ? value.substring(0, value.length() - 1) :
              value);
    }
  }, REAL(Double.class) {
    @Override
    public Double parse(String value) {
      return Double.parseDouble(
          value.endsWith("D") || value.endsWith("d") ? value.substring(0, value.length() - 1) :
              value);
    }
  }, TEXT(String.class) {
    @Override
    public String parse(String value) {
      return value;
    }
  }, FLAG(Boolean.class) {
    @Override
    public Boolean parse(String value) {
      if (value.equalsIgnoreCase("true")) {
        return Boolean.TRUE;
      } else if (value.equalsIgnoreCase("false")) {
        return Boolean.FALSE;
      }
      throw new IllegalArgumentException("not a flag literal: '" + value + "'");
    }
  };

  /// the Java type which carries values of this kind
  public final Class<?> type;

  MetaType(Class<?> type) {
    this.type = type;
  }

  /// parse a literal as a value of this kind
  /// @param value
  ///     the literal
  /// @return the parsed value, an instance of [#type]
  /// @throws IllegalArgumentException
  ///     if the literal is not valid for this kind
  public abstract Object parse(String value);

  /// infer the kind of a literal
  /// @param value
  ///     the literal
  /// @return the inferred kind
  public static MetaType fromLiteral(String value) {
    if (value.matches("[+-]?\\d+[lL]?") && fitsLong(value)) {
      return INTEGER;
    } else if (value.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?[dD]?")) {
      return REAL;
    } else if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
      return FLAG;
    } else {
      return TEXT;
    }
  }

  /// find the kind which carries a given Java type
  /// @param javaType
  ///     a value class
  /// @return the kind, or null if no kind carries it
  public static MetaType forJavaType(Class<?> javaType) {
    for (MetaType metaType : values()) {
      if (metaType.type.equals(javaType)) {
        return metaType;
      }
    }
    return null;
  }

  private static boolean fitsLong(String value) {
    try {
      INTEGER.parse(value);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
