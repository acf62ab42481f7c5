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

package io.insight2d.specdata.formats;

import java.util.Locale;
import java.util.regex.Pattern;

/// Parsing of numeric cells shared by the text-based codecs.
///
/// Accepts plain decimal literals with an optional exponent, such as `12`, `-0.5`, `.5` or
/// `3e-2`, plus the spellings `nan`, `inf`, `+inf`, `-inf`, `infinity` and `-infinity` in any
/// case. Java-only forms such as `1d`, `2f` or `0x1p3` are rejected.
public final class NumericTokens {

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private NumericTokens() {
  }

  /// @param token
  ///     a trimmed, non-empty token
  /// @return the parsed value
  /// @throws NumberFormatException
  ///     if the token is not numeric
  public static double parse(String token) {
    switch (token.toLowerCase(Locale.ROOT)) {
      case "nan":
      case "+nan":
      case "-nan":
        return Double.NaN;
      case "inf":
      case "+inf":
      case "infinity":
      case "+infinity":
        return Double.POSITIVE_INFINITY;
      case "-inf":
      case "-infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        if (!DECIMAL.matcher(token).matches()) {
          throw new NumberFormatException("not a decimal number: '" + token + "'");
        }
        return Double.parseDouble(token);
    }
  }

  /// Format a value so that [#parse(String)] yields exactly the same double.
  public static String format(double value) {
    return Double.toString(value);
  }
}
