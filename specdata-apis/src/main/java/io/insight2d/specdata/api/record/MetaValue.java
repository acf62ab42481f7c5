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

import io.insight2d.specdata.api.errors.UnsupportedMetadataTypeException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// A single metadata value: one of the kinds in [MetaType] together with its Java value.
///
/// Metadata is carried opaquely by this layer. Restricting values to this small variant lets each
/// encoder state exactly which kinds it can store, and fail predictably for the others.
public final class MetaValue {

  /// a pattern to match typed literals such as `(text)0042`
  public static final Pattern SPEC_PATTERN = Pattern.compile(
      "(?:\\((?<typename>[a-zA-Z]+)\\))?(?<literal>.*)", Pattern.DOTALL);

  private final MetaType type;
  private final Object value;

  private MetaValue(MetaType type, Object value) {
    this.type = type;
    this.value = value;
  }

  public static MetaValue of(long value) {
    return new MetaValue(MetaType.INTEGER, value);
  }

  public static MetaValue of(double value) {
    return new MetaValue(MetaType.REAL, value);
  }

  public static MetaValue of(String value) {
    return new MetaValue(MetaType.TEXT, Objects.requireNonNull(value, "text metadata value"));
  }

  public static MetaValue of(boolean value) {
    return new MetaValue(MetaType.FLAG, value);
  }

  /// Convert a plain Java scalar into a metadata value. Integral boxes widen to INTEGER and
  /// floating-point boxes widen to REAL.
  /// @param key
  ///     the metadata key, used for error reporting
  /// @param value
  ///     the Java value
  /// @return the metadata value
  /// @throws UnsupportedMetadataTypeException
  ///     if the value is null or not a supported scalar
  public static MetaValue from(String key, Object value) {
    if (value instanceof MetaValue mv) {
      return mv;
    } else if (value instanceof Long || value instanceof Integer || value instanceof Short
               || value instanceof Byte) {
      return of(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      return of(((Number) value).doubleValue());
    } else if (value instanceof String s) {
      return of(s);
    } else if (value instanceof Boolean b) {
      return of(b.booleanValue());
    }
    throw new UnsupportedMetadataTypeException(
        key, value == null ? "null" : value.getClass().getSimpleName());
  }

  /// Parse a metadata literal, with an optional type prefix in parentheses.
  /// Without a prefix the type is inferred with [MetaType#fromLiteral(String)].
  /// @param spec
  ///     the literal, for example `12`, `(real)12` or `(text)true`
  /// @return the parsed value
  /// @throws IllegalArgumentException
  ///     if the prefix names no type, or the literal does not parse as that type
  public static MetaValue parse(String spec) {
    Matcher m = SPEC_PATTERN.matcher(spec);
    if (!m.matches()) {
      throw new IllegalArgumentException("Invalid metadata value format: " + spec);
    }
    String typename = m.group("typename");
    String literal = m.group("literal");
    MetaType type = typename == null ? MetaType.fromLiteral(literal) :
        MetaType.valueOf(typename.toUpperCase());
    return new MetaValue(type, type.parse(literal));
  }

  public MetaType type() {
    return type;
  }

  /// @return the value, an instance of the Java type of [#type()]
  public Object value() {
    return value;
  }

  public long asLong() {
    return requireType(MetaType.INTEGER, Long.class);
  }

  public double asDouble() {
    return requireType(MetaType.REAL, Double.class);
  }

  public String asText() {
    return requireType(MetaType.TEXT, String.class);
  }

  public boolean asFlag() {
    return requireType(MetaType.FLAG, Boolean.class);
  }

  private <T> T requireType(MetaType expected, Class<T> javaType) {
    if (type != expected) {
      throw new IllegalStateException("metadata value is " + type + ", not " + expected);
    }
    return javaType.cast(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    MetaValue other = (MetaValue) obj;
    return type == other.type && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + value.hashCode();
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
