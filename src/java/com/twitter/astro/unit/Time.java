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

import java.math.RoundingMode;
import java.util.Locale;

import com.google.common.base.Preconditions;
import com.google.common.math.DoubleMath;

/**
 * A duration or relative time.  The value is stored as seconds; 86400 seconds make a day, and one
 * day corresponds to one circle of {@link Angle} or one revolution of {@link HourAngle}.
 */
public final class Time implements Comparable<Time> {

  /**
   * One day, in seconds.
   */
  public static final double SECONDS_PER_DAY = 3600 * 24;

  private static final long MICROS_PER_SECOND = 1000000L;
  private static final long MICROS_PER_MINUTE = 60 * MICROS_PER_SECOND;
  private static final long MICROS_PER_HOUR = 60 * MICROS_PER_MINUTE;

  // Largest magnitude whose microsecond count still fits in a long.
  private static final double MAX_RENDERABLE_SECONDS = Long.MAX_VALUE / MICROS_PER_SECOND - 1;

  private final double sec;

  private Time(double sec) {
    this.sec = sec;
  }

  public static Time fromSeconds(double sec) {
    return new Time(sec);
  }

  /**
   * Creates a time from sign, hour, minute and second components.  Components are not range
   * checked; see {@link Sexagesimal}.
   */
  public static Time fromSexagesimal(char sign, int hour, int min, double sec) {
    return new Time((sec + (hour * 60L + min) * 60L) * (Sexagesimal.isNegative(sign) ? -1 : 1));
  }

  public static Time fromDays(double day) {
    // 3600 sec in an hour, 24 hours in a day.
    return new Time(day * 3600 * 24);
  }

  public static Time fromHours(double hour) {
    return new Time(hour * 3600);
  }

  public static Time fromMinutes(double min) {
    return new Time(min * 60);
  }

  /**
   * Creates a time from radians where 2 pi radians correspond to one day.
   */
  public static Time fromRadians(double rad) {
    // 3600 sec in an hour, 12 hours or pi radians in a half-day.
    return new Time(rad * 3600 * 12 / Math.PI);
  }

  public static Time of(double value, DurationUnit unit) {
    Preconditions.checkNotNull(unit);
    return new Time(unit.toCanonical(value));
  }

  /**
   * Returns the underlying number of seconds; no scaling is involved.
   */
  public double seconds() {
    return sec;
  }

  public double days() {
    return sec / 3600 / 24;
  }

  public double hours() {
    return sec / 3600;
  }

  public double minutes() {
    return sec / 60;
  }

  /**
   * Returns this time in radians, where one day is 2 pi radians of rotation.
   */
  public double radians() {
    return sec / 3600 / 12 * Math.PI;
  }

  public double as(DurationUnit unit) {
    Preconditions.checkNotNull(unit);
    return unit.fromCanonical(sec);
  }

  public Angle asAngle() {
    return Angle.fromRadians(radians());
  }

  public HourAngle asHourAngle() {
    return HourAngle.fromRadians(radians());
  }

  public Time add(Time other) {
    return new Time(sec + other.sec);
  }

  public Time subtract(Time other) {
    return new Time(sec - other.sec);
  }

  public Time multiply(double factor) {
    return new Time(sec * factor);
  }

  public Time divide(double divisor) {
    return new Time(sec / divisor);
  }

  /**
   * Returns this time wrapped to one day, the range {@code [0, 86400)} seconds.  Negative times
   * wrap to the equivalent time of day.
   */
  public Time mod1() {
    return new Time(CanonicalValues.floorMod(sec, SECONDS_PER_DAY));
  }

  public boolean isLessThan(Time other) {
    return sec < other.sec;
  }

  public boolean isAtMost(Time other) {
    return sec <= other.sec;
  }

  public boolean isGreaterThan(Time other) {
    return sec > other.sec;
  }

  public boolean isAtLeast(Time other) {
    return sec >= other.sec;
  }

  /**
   * Renders this time as a signed {@code H:MM:SS.ffffff} duration string, eg:
   * {@code -12:34:45.600000}.  Hours are not bounded to a day.
   *
   * <p>The seconds value is split into whole seconds, milliseconds and microseconds by truncating
   * successive fractional remainders, with the microseconds rounded half away from zero.
   *
   * @throws IllegalStateException if this time is not finite or its microsecond count overflows a
   *     {@code long}
   */
  public String toDurationString() {
    Preconditions.checkState(Math.abs(sec) <= MAX_RENDERABLE_SECONDS,
        "Cannot render %s seconds as a duration", sec);

    long wholeSeconds = DoubleMath.roundToLong(sec, RoundingMode.DOWN);
    double millisFraction = (sec - wholeSeconds) * 1000;
    long millis = DoubleMath.roundToLong(millisFraction, RoundingMode.DOWN);
    long micros = DoubleMath.roundToLong((millisFraction - millis) * 1000, RoundingMode.HALF_UP);
    long totalMicros = wholeSeconds * MICROS_PER_SECOND + millis * 1000 + micros;

    String sign = totalMicros < 0 ? "-" : "";
    long magnitude = Math.abs(totalMicros);
    return String.format(Locale.ENGLISH, "%s%d:%02d:%02d.%06d",
        sign,
        magnitude / MICROS_PER_HOUR,
        (magnitude % MICROS_PER_HOUR) / MICROS_PER_MINUTE,
        (magnitude % MICROS_PER_MINUTE) / MICROS_PER_SECOND,
        magnitude % MICROS_PER_SECOND);
  }

  @Override
  public int compareTo(Time other) {
    return CanonicalValues.compare(sec, other.sec);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Time)) {
      return false;
    }
    return CanonicalValues.equal(sec, ((Time) obj).sec);
  }

  @Override
  public int hashCode() {
    return CanonicalValues.hash(sec);
  }

  @Override
  public String toString() {
    return Double.toString(sec);
  }
}
