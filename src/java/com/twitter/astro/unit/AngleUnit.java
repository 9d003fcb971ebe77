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
 * Provides units for plane {@link Angle}s, where 360 degrees make a circle.  The canonical unit is
 * {@link #RADIANS}.
 */
public enum AngleUnit implements Unit<AngleUnit> {
  RADIANS("rad") {
    @Override public double toCanonical(double value) {
      return value;
    }

    @Override public double fromCanonical(double canonical) {
      return canonical;
    }
  },
  DEGREES("deg") {
    @Override public double toCanonical(double value) {
      return Angle.fromDegrees(value).radians();
    }

    @Override public double fromCanonical(double canonical) {
      return Angle.fromRadians(canonical).degrees();
    }
  },
  ARC_MINUTES("arcmin") {
    @Override public double toCanonical(double value) {
      return Angle.fromArcMinutes(value).radians();
    }

    @Override public double fromCanonical(double canonical) {
      return Angle.fromRadians(canonical).arcMinutes();
    }
  },
  ARC_SECONDS("arcsec") {
    @Override public double toCanonical(double value) {
      return Angle.fromArcSeconds(value).radians();
    }

    @Override public double fromCanonical(double canonical) {
      return Angle.fromRadians(canonical).arcSeconds();
    }
  };

  private final String display;

  private AngleUnit(String display) {
    this.display = display;
  }

  @Override
  public String toString() {
    return display;
  }
}
