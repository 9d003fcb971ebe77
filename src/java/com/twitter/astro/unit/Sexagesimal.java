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

/**
 * Converts parsed sexagesimal components to a single scalar value.
 *
 * <p>Typically callers pass non-negative values for the major, minor and sub-unit components and
 * pass {@link #NEGATIVE} as the sign to indicate a negative value.  Any other sign, such as
 * {@code ' '}, {@code '+'} or {@code '\0'}, leaves the result non-negative.
 *
 * <p>There are no limits on the components.  Negative values or values of 60 and beyond for the
 * minor and sub-unit components are combined arithmetically and the sum is then negated if the
 * sign is {@link #NEGATIVE}.  So {@code toScalarInMajorUnit(' ', -20, 30, 0)} is {@code -19.5},
 * while {@code toScalarInMajorUnit('-', 20, 30, 0)} is {@code -20.5}.
 *
 * <p>The interpretation of the major component as degrees or hours is arbitrary: the minor
 * component is a sexagesimal part of the major one and the sub-unit component is a sexagesimal
 * part of the minor one, whatever the units.
 */
public final class Sexagesimal {

  /**
   * The only sign marker that negates a sexagesimal value.
   */
  public static final char NEGATIVE = '-';

  private Sexagesimal() {
    // utility
  }

  /**
   * Combines sexagesimal components into a value in the unit of the sub-unit (smallest) component.
   *
   * @param sign {@link #NEGATIVE} to negate the result, anything else to leave it as is
   * @param major the largest component; eg: degrees or hours
   * @param minor the sexagesimal part of {@code major}; eg: minutes
   * @param subunit the sexagesimal part of {@code minor}; eg: seconds
   * @return the combined value in units of {@code subunit}
   */
  public static double toScalarInSubunit(char sign, int major, int minor, double subunit) {
    double total = ((major * 60L + minor) * 60L) + subunit;
    return isNegative(sign) ? -total : total;
  }

  /**
   * Combines sexagesimal components into a value in the unit of the major (largest) component.
   *
   * @see #toScalarInSubunit(char, int, int, double)
   */
  public static double toScalarInMajorUnit(char sign, int major, int minor, double subunit) {
    return toScalarInSubunit(sign, major, minor, subunit) / 3600;
  }

  /**
   * Returns {@code true} if {@code sign} marks a negative sexagesimal value.
   */
  public static boolean isNegative(char sign) {
    return sign == NEGATIVE;
  }
}
