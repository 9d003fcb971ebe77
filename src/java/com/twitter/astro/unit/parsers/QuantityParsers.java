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

package com.twitter.astro.unit.parsers;

import java.util.EnumSet;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Functions;
import com.google.common.collect.Maps;

import org.apache.commons.lang.StringUtils;

import com.twitter.astro.unit.Angle;
import com.twitter.astro.unit.AngleUnit;
import com.twitter.astro.unit.DurationUnit;
import com.twitter.astro.unit.HourAngle;
import com.twitter.astro.unit.HourAngleUnit;
import com.twitter.astro.unit.Time;
import com.twitter.astro.unit.Unit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parses angle, hour angle and time values from flags and configuration strings.
 *
 * <p>Two formats are accepted:
 * <ul>
 *   <li>a signed decimal number immediately followed by a unit name, eg: {@code -23.5deg},
 *       {@code 1.5h} or {@code 2hrs}.  Unit names are matched (case sensitively) against the
 *       {@code toString()} of the unit enum for the parsed type.
 *   <li>sexagesimal {@code [+-]major:minor:sub}, eg: {@code -12:34:45.6}, where major is degrees
 *       for angles and hours for hour angles and times.
 * </ul>
 *
 * Sexagesimal minor and sub-unit components of 60 or more are accepted and combined
 * arithmetically, but are logged since they usually indicate a typo.
 */
public final class QuantityParsers {

  private static final Logger LOG = Logger.getLogger(QuantityParsers.class.getName());

  private static final Pattern AMOUNT_PATTERN =
      Pattern.compile("([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?)\\s*([A-Za-z]+)");

  private static final Pattern SEXAGESIMAL_PATTERN =
      Pattern.compile("([+-]?)(\\d+):(\\d+):(\\d+(?:\\.\\d*)?)");

  private static final Map<String, AngleUnit> ANGLE_UNITS = indexUnits(AngleUnit.class);
  private static final Map<String, HourAngleUnit> HOUR_ANGLE_UNITS =
      indexUnits(HourAngleUnit.class);
  private static final Map<String, DurationUnit> DURATION_UNITS = indexUnits(DurationUnit.class);

  private QuantityParsers() {
    // utility
  }

  /**
   * Parses an angle such as {@code 23.5deg}, {@code 90arcmin} or {@code -23:26:21.4}.
   *
   * @throws IllegalArgumentException if {@code raw} is not in a recognized format
   */
  public static Angle parseAngle(String raw) {
    String value = normalize(raw);
    Matcher sexagesimal = SEXAGESIMAL_PATTERN.matcher(value);
    if (sexagesimal.matches()) {
      Components c = Components.from(sexagesimal, raw);
      return Angle.fromSexagesimal(c.sign, c.major, c.minor, c.subunit);
    }
    Quantity<AngleUnit> quantity = parseQuantity(value, ANGLE_UNITS);
    return Angle.of(quantity.value, quantity.unit);
  }

  /**
   * Parses an hour angle such as {@code 1.5h}, {@code 90m} or {@code 5:35:17.3}.
   *
   * @throws IllegalArgumentException if {@code raw} is not in a recognized format
   */
  public static HourAngle parseHourAngle(String raw) {
    String value = normalize(raw);
    Matcher sexagesimal = SEXAGESIMAL_PATTERN.matcher(value);
    if (sexagesimal.matches()) {
      Components c = Components.from(sexagesimal, raw);
      return HourAngle.fromSexagesimal(c.sign, c.major, c.minor, c.subunit);
    }
    Quantity<HourAngleUnit> quantity = parseQuantity(value, HOUR_ANGLE_UNITS);
    return HourAngle.of(quantity.value, quantity.unit);
  }

  /**
   * Parses a time such as {@code 2hrs}, {@code 0.5days} or {@code -12:34:45.6}.
   *
   * @throws IllegalArgumentException if {@code raw} is not in a recognized format
   */
  public static Time parseTime(String raw) {
    String value = normalize(raw);
    Matcher sexagesimal = SEXAGESIMAL_PATTERN.matcher(value);
    if (sexagesimal.matches()) {
      Components c = Components.from(sexagesimal, raw);
      return Time.fromSexagesimal(c.sign, c.major, c.minor, c.subunit);
    }
    Quantity<DurationUnit> quantity = parseQuantity(value, DURATION_UNITS);
    return Time.of(quantity.value, quantity.unit);
  }

  private static String normalize(String raw) {
    checkArgument(!StringUtils.isBlank(raw), "Value to parse cannot be blank");
    return StringUtils.trim(raw);
  }

  private static <U extends Enum<U> & Unit<U>> Map<String, U> indexUnits(Class<U> unitType) {
    return Maps.uniqueIndex(EnumSet.allOf(unitType), Functions.toStringFunction());
  }

  private static <U extends Unit<U>> Quantity<U> parseQuantity(String raw, Map<String, U> units) {
    Matcher matcher = AMOUNT_PATTERN.matcher(raw);
    checkArgument(matcher.matches(), String.format(
        "Value '%s' must be of the format 23.5%s or [+-]major:minor:sub, eg: -12:34:45.6",
        raw, units.keySet().iterator().next()));

    U unit = units.get(matcher.group(2));
    checkArgument(unit != null, String.format(
        "No units found matching %s, options: %s", matcher.group(2), units.keySet()));
    return new Quantity<U>(Double.parseDouble(matcher.group(1)), unit);
  }

  private static final class Quantity<U extends Unit<U>> {
    private final double value;
    private final U unit;

    Quantity(double value, U unit) {
      this.value = value;
      this.unit = unit;
    }
  }

  private static final class Components {
    private final char sign;
    private final int major;
    private final int minor;
    private final double subunit;

    private Components(char sign, int major, int minor, double subunit) {
      this.sign = sign;
      this.major = major;
      this.minor = minor;
      this.subunit = subunit;
    }

    static Components from(Matcher matcher, String raw) {
      char sign = matcher.group(1).isEmpty() ? '+' : matcher.group(1).charAt(0);
      int major = parseComponent(matcher.group(2), raw);
      int minor = parseComponent(matcher.group(3), raw);
      double subunit = Double.parseDouble(matcher.group(4));
      if (minor >= 60 || subunit >= 60) {
        LOG.warning(String.format(
            "Sexagesimal value '%s' has components of 60 or more, combining them as given", raw));
      }
      return new Components(sign, major, minor, subunit);
    }

    private static int parseComponent(String digits, String raw) {
      try {
        return Integer.parseInt(digits);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Sexagesimal component " + digits + " of '" + raw + "' is out of range", e);
      }
    }
  }
}
