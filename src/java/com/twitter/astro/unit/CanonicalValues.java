// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.twitter.astro.unit;

import com.google.common.primitives.Doubles;

/**
 * Comparison and wrapping helpers shared by the value types, all of which wrap a single canonical
 * {@code double}.
 */
final class CanonicalValues {

  private CanonicalValues() {
    // utility
  }

  /**
   * Floor modulo: the result has the sign of {@code divisor}, so for a positive divisor it always
   * lies in {@code [0, divisor)}.
   */
  static double floorMod(double dividend, double divisor) {
    double remainder = dividend % divisor;
    if (remainder != 0 && (remainder < 0) != (divisor < 0)) {
      remainder += divisor;
      // A tiny remainder of the opposite sign can round up to the divisor itself.
      if (remainder == divisor) {
        return 0;
      }
    }
    return remainder;
  }

  static boolean equal(double a, double b) {
    return Double.compare(normalize(a), normalize(b)) == 0;
  }

  static int compare(double a, double b) {
    return Double.compare(normalize(a), normalize(b));
  }

  static int hash(double value) {
    return Doubles.hashCode(normalize(value));
  }

  // Treats -0.0 as 0.0 so that equality agrees with ==.
  private static double normalize(double value) {
    return value == 0.0 ? 0.0 : value;
  }
}
