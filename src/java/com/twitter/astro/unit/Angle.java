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
 * A general purpose plane angle.  The value is stored as radians; 2 pi radians or 360 degrees make
 * a circle.
 *
 * <p>Instances are immutable and are created via static factory methods.  Ordering and equality
 * compare radian values directly and do not account for wrap around: an angle just short of a full
 * circle is greater than one just past zero.  Call {@link #mod1()} on both sides first when that
 * matters.
 */
public final class Angle implements Comparable<Angle> {

  /**
   * One full circle, in radians.
   */
  public static final double FULL_CIRCLE = 2 * Math.PI;

  private final double rad;

  private Angle(double rad) {
    this.rad = rad;
  }

  public static Angle fromRadians(double rad) {
    return new Angle(rad);
  }

  /**
   * Creates an angle from degrees where there are 360 degrees to a circle.
   */
  public static Angle fromDegrees(double deg) {
    // 180 deg or pi radians in a half-circle.
    return new Angle(deg / 180 * Math.PI);
  }

  /**
   * Creates an angle from minutes of arc where there are 60 minutes to a degree.
   */
  public static Angle fromArcMinutes(double min) {
    return new Angle(min / 60 / 180 * Math.PI);
  }

  /**
   * Creates an angle from seconds of arc where there are 60 seconds to a minute and 60 minutes to
   * a degree.
   */
  public static Angle fromArcSeconds(double sec) {
    return new Angle(sec / 3600 / 180 * Math.PI);
  }

  /**
   * Creates an angle from sign, degree, minute and second components.
   *
   * @see Sexagesimal#toScalarInSubunit(char, int, int, double)
   */
  public static Angle fromSexagesimal(char sign, int deg, int min, double sec) {
    return fromArcSeconds(Sexagesimal.toScalarInSubunit(sign, deg, min, sec));
  }

  /**
   * Creates an angle of {@code value} {@code unit}s.
   */
  public static Angle of(double value, AngleUnit unit) {
    Preconditions.checkNotNull(unit);
    return new Angle(unit.toCanonical(value));
  }

  /**
   * Returns the underlying radian value; no scaling is involved.
   */
  public double radians() {
    return rad;
  }

  public double degrees() {
    return rad * 180 / Math.PI;
  }

  public double arcMinutes() {
    return rad * 60 * 180 / Math.PI;
  }

  public double arcSeconds() {
    return rad * 3600 * 180 / Math.PI;
  }

  /**
   * Returns this angle expressed in {@code unit}s.
   */
  public double as(AngleUnit unit) {
    Preconditions.checkNotNull(unit);
    return unit.fromCanonical(rad);
  }

  /**
   * Returns the hour angle with the same radian value; one circle corresponds to one revolution.
   */
  public HourAngle asHourAngle() {
    return HourAngle.fromRadians(rad);
  }

  /**
   * Returns the time where one circle corresponds to one day.
   */
  public Time asTime() {
    return Time.fromRadians(rad);
  }

  public Angle add(Angle other) {
    return new Angle(rad + other.rad);
  }

  public Angle subtract(Angle other) {
    return new Angle(rad - other.rad);
  }

  public Angle multiply(double factor) {
    return new Angle(rad * factor);
  }

  public Angle divide(double divisor) {
    return new Angle(rad / divisor);
  }

  public Angle abs() {
    return new Angle(Math.abs(rad));
  }

  /**
   * Returns this angle wrapped to one circle, the range {@code [0, 2 pi)} radians.
   */
  public Angle mod1() {
    return new Angle(CanonicalValues.floorMod(rad, FULL_CIRCLE));
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

  public boolean isLessThan(Angle other) {
    return rad < other.rad;
  }

  public boolean isAtMost(Angle other) {
    return rad <= other.rad;
  }

  public boolean isGreaterThan(Angle other) {
    return rad > other.rad;
  }

  public boolean isAtLeast(Angle other) {
    return rad >= other.rad;
  }

  @Override
  public int compareTo(Angle other) {
    return CanonicalValues.compare(rad, other.rad);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Angle)) {
      return false;
    }
    return CanonicalValues.equal(rad, ((Angle) obj).rad);
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
