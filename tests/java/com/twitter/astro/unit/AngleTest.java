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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.testing.EqualsTester;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AngleTest {

  private static final double EPSILON = 1e-6;

  @Test
  public void testFromDegrees() {
    assertEquals(Math.PI, Angle.fromDegrees(180).radians(), 0);
    assertEquals(Math.PI / 2, Angle.fromRadians(Math.PI / 2).radians(), 0);
    assertEquals(90, Angle.fromRadians(Math.PI / 2).degrees(), 1e-12);
  }

  @Test
  public void testDegreesRoundTrip() {
    for (double degrees : new double[] {0, 1, -1, 23.4392911, 180, -337, 383, 1e6, 1e-9}) {
      assertEquals(degrees, Angle.fromDegrees(degrees).degrees(), Math.abs(degrees) * 1e-14);
    }
  }

  @Test
  public void testFromArcMinutesAndSeconds() {
    assertEquals(83 * 60, Angle.fromArcMinutes(83).arcSeconds(), EPSILON);
    assertEquals(83, Angle.fromArcSeconds(83).arcSeconds(), EPSILON);
    assertEquals(83, Angle.fromSexagesimal(' ', 1, 23, 0).arcMinutes(), EPSILON);
    assertEquals(83, Angle.fromSexagesimal(' ', 0, 1, 23).arcSeconds(), EPSILON);
  }

  @Test
  public void testFromSexagesimal() {
    assertEquals(-32 - 41 / 60.0, Angle.fromSexagesimal('-', 0, 32, 41).arcMinutes(), EPSILON);
    assertEquals(32 + 41 / 60.0, Angle.fromSexagesimal(' ', 0, 32, 41).arcMinutes(), EPSILON);
    assertEquals(32 + 41 / 60.0, Angle.fromSexagesimal('+', 0, 32, 41).arcMinutes(), EPSILON);
    assertEquals(32 + 41 / 60.0, Angle.fromSexagesimal('\0', 0, 32, 41).arcMinutes(), EPSILON);

    // Conversion to radians happens up front; reading them back is free.
    assertEquals(Math.PI, Angle.fromSexagesimal(' ', 180, 0, 0).radians(), 0);
    assertEquals(Angle.fromDegrees(-30), Angle.fromSexagesimal('\0', -30, 0, 0));
  }

  @Test
  public void testOfAndAs() {
    assertEquals(Angle.fromDegrees(90), Angle.of(90, AngleUnit.DEGREES));
    assertEquals(Angle.fromArcMinutes(83), Angle.of(83, AngleUnit.ARC_MINUTES));
    assertEquals(Angle.fromArcSeconds(83), Angle.of(83, AngleUnit.ARC_SECONDS));
    assertEquals(Angle.fromRadians(1.25), Angle.of(1.25, AngleUnit.RADIANS));

    Angle angle = Angle.fromSexagesimal(' ', 12, 30, 0);
    assertEquals(angle.degrees(), angle.as(AngleUnit.DEGREES), 0);
    assertEquals(angle.arcMinutes(), angle.as(AngleUnit.ARC_MINUTES), 0);
    assertEquals(angle.arcSeconds(), angle.as(AngleUnit.ARC_SECONDS), 0);
    assertEquals(angle.radians(), angle.as(AngleUnit.RADIANS), 0);
  }

  @Test(expected = NullPointerException.class)
  public void testOfRequiresUnit() {
    Angle.of(1, null);
  }

  @Test
  public void testTrigonometry() {
    Angle sixty = Angle.fromDegrees(60);
    assertEquals(0.866025, sixty.sin(), EPSILON);
    assertEquals(0.5, sixty.cos(), EPSILON);
    assertEquals(1.732051, sixty.tan(), EPSILON);
  }

  @Test
  public void testConversions() {
    Angle angle = Angle.fromDegrees(-30);
    assertEquals(HourAngle.fromHours(-2), angle.asHourAngle());
    assertEquals(-7200, angle.asTime().seconds(), EPSILON);

    for (double degrees : new double[] {0, 15, -30, 359.5, 720.25}) {
      Angle a = Angle.fromDegrees(degrees);
      assertEquals(a.radians(), a.asHourAngle().asAngle().radians(), 0);
    }
  }

  @Test
  public void testArithmetic() {
    Angle halfCircle = Angle.fromRadians(Math.PI);
    Angle rightAngle = Angle.fromDegrees(90);
    assertEquals(270, halfCircle.add(rightAngle).degrees(), EPSILON);
    assertEquals(90, halfCircle.subtract(rightAngle).degrees(), EPSILON);

    assertEquals(Angle.fromDegrees(90), Angle.fromDegrees(45).multiply(2));
    assertEquals(45, Angle.fromDegrees(90).divide(2).degrees(), EPSILON);
    assertEquals(Angle.fromDegrees(12.5), Angle.fromDegrees(-12.5).abs());
  }

  @Test
  public void testMultiplyDivideInverse() {
    Angle angle = Angle.fromSexagesimal('-', 23, 26, 21.406);
    for (double factor : new double[] {3, -0.25, 1e-3, 7.5e4}) {
      assertEquals(angle.radians(), angle.multiply(factor).divide(factor).radians(), 1e-15);
    }
  }

  @Test
  public void testDivideByZero() {
    assertEquals(Double.POSITIVE_INFINITY, Angle.fromDegrees(1).divide(0).radians(), 0);
    assertTrue(Double.isNaN(Angle.fromDegrees(0).divide(0).radians()));
  }

  @Test
  public void testMod1() {
    assertEquals(Angle.fromDegrees(23), Angle.fromDegrees(23).mod1());
    assertEquals(Angle.fromDegrees(23).radians(), Angle.fromDegrees(383).mod1().radians(), 1e-12);
    assertEquals(Angle.fromDegrees(23).radians(), Angle.fromDegrees(-337).mod1().radians(), 1e-12);
    assertEquals(0, Angle.fromDegrees(360).mod1().radians(), 1e-12);

    Angle wrapped = Angle.fromRadians(-1e-20).mod1();
    assertTrue(wrapped.radians() >= 0);
    assertTrue(wrapped.radians() < Angle.FULL_CIRCLE);
  }

  @Test
  public void testOrdering() {
    Angle small = Angle.fromDegrees(1);
    Angle large = Angle.fromDegrees(359);

    assertTrue(small.isLessThan(large));
    assertTrue(small.isAtMost(large));
    assertTrue(small.isAtMost(Angle.fromDegrees(1)));
    assertFalse(small.isGreaterThan(large));
    assertTrue(large.isAtLeast(small));
    assertTrue("ordering does not account for wrap around",
        Angle.fromDegrees(361).compareTo(large) > 0);
    assertTrue(Angle.fromDegrees(361).mod1().compareTo(large) < 0);

    assertEquals(
        ImmutableList.of(Angle.fromDegrees(-90), small, large),
        Ordering.<Angle>natural().sortedCopy(ImmutableList.of(large, Angle.fromDegrees(-90), small)));
  }

  @Test
  public void testEquals() {
    new EqualsTester()
        .addEqualityGroup(
            Angle.fromDegrees(90), Angle.fromRadians(Math.PI / 2), Angle.of(90, AngleUnit.DEGREES))
        .addEqualityGroup(Angle.fromDegrees(0), Angle.fromRadians(-0.0))
        .addEqualityGroup(Angle.fromRadians(Double.NaN), Angle.fromRadians(Double.NaN))
        .addEqualityGroup(Angle.fromDegrees(91))
        .testEquals();

    assertFalse("angles and hour angles of the same radian value are different types",
        Angle.fromRadians(1).equals(HourAngle.fromRadians(1)));
  }

  @Test
  public void testToString() {
    assertEquals(Double.toString(Math.PI), Angle.fromDegrees(180).toString());
  }
}
