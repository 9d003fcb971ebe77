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

import com.google.common.base.Preconditions;

/**
 * An angle corresponding to the rotation of the Earth, where 24 hours make a revolution.  The
 * value is stored as radians, so an hour angle and an {@link Angle} of the same radian value
 * describe the same rotation.
 *
 * <p>The two types do not mix: arithmetic takes another hour angle, and an {@link Angle} operand
 * has to be converted with {@link Angle#asHourAngle()} first.
 */
public final class HourAngle implements Comparable<HourAngle> {

  /**
   * One full revolution, in radians.
   */
  public static final double FULL_REVOLUTION = 2 * Math.PI;

  private final double rad;

  private HourAngle(double rad) {
    this.rad = rad;
  }

  public static HourAngle fromRadians(double rad) {
    return new HourAngle(rad);
  }

  /**
   * Creates an hour angle from hours of revolution.
   */
  public static HourAngle fromHours(double hour) {
    // 12 hours or pi radians in a half-revolution.
    return new HourAngle(hour / 12 * Math.PI);
  }

  /**
   * Creates an hour angle from minutes of revolution where there are 60 minutes to an hour.
   */
  public static HourAngle fromMinutes(double min) {
    return new HourAngle(min / 60 / 12 * Math.PI);
  }

  /**
   * Creates an hour angle from seconds of revolution where there are 3600 seconds to an hour.
   */
  public static HourAngle fromSeconds(double sec) {
    return new HourAngle(sec / 3600 / 12 * Math.PI);
  }

  /**
   * Creates an hour angle from sign, hour, minute and second components.
   *
   * @see Sexagesimal#toScalarInMajorUnit(char, int, int, double)
   */
  public static HourAngle fromSexagesimal(char sign, int hour, int min, double sec) {
    return new HourAngle(Sexagesimal.toScalarInMajorUnit(sign, hour, min, sec) / 12 * Math.PI);
  }

  public static HourAngle of(double value, HourAngleUnit unit) {
    Preconditions.checkNotNull(unit);
    return new HourAngle(unit.toCanonical(value));
  }

  /**
   * Returns the underlying radian value; no scaling is involved.
   */
  public double radians() {
    return rad;
  }

  public double hours() {
    return rad * 12 / Math.PI;
  }

  public double minutes() {
    return rad * 60 * 12 / Math.PI;
  }

  public double seconds() {
    return rad * 3600 * 12 / Math.PI;
  }

  public double as(HourAngleUnit unit) {
    Preconditions.checkNotNull(unit);
    return unit.fromCanonical(rad);
  }

  /**
   * Returns the angle with the same radian value; one revolution corresponds to one circle.
   */
  public Angle asAngle() {
    return Angle.fromRadians(rad);
  }

  /**
   * Returns the time where one revolution corresponds to one day, so seconds of revolution map
   * directly to seconds of time.
   */
  public Time asTime() {
    return Time.fromSeconds(seconds());
  }

  public HourAngle add(HourAngle other) {
    return new HourAngle(rad + other.rad);
  }

  public HourAngle subtract(HourAngle other) {
    return new HourAngle(rad - other.rad);
  }

  public HourAngle multiply(double factor) {
    return new HourAngle(rad * factor);
  }

  public HourAngle divide(double divisor) {
    return new HourAngle(rad / divisor);
  }

  public HourAngle abs() {
    return new HourAngle(Math.abs(rad));
  }

  /**
   * Returns this hour angle wrapped to one revolution, the range {@code [0, 24)} hours.
   */
  public HourAngle mod1() {
    return new HourAngle(CanonicalValues.floorMod(rad, FULL_REVOLUTION));
  }

  public double sin() {
    return Math.sin(rad);
  }

  public double cos() {
    return Math.cos(rad);
  }

  public double tan() {
    return Math.tan(rad);
  }

  public boolean isLessThan(HourAngle other) {
    return rad < other.rad;
  }

  public boolean isAtMost(HourAngle other) {
    return rad <= other.rad;
  }

  public boolean isGreaterThan(HourAngle other) {
    return rad > other.rad;
  }

  public boolean isAtLeast(HourAngle other) {
    return rad >= other.rad;
  }

  @Override
  public int compareTo(HourAngle other) {
    return CanonicalValues.compare(rad, other.rad);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof HourAngle)) {
      return false;
    }
    return CanonicalValues.equal(rad, ((HourAngle) obj).rad);
  }

  @Override
  public int hashCode() {
    return CanonicalValues.hash(rad);
  }

  @Override
  public String toString() {
    return Double.toString(rad);
  }
}
