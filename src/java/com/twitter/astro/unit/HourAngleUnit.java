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
 * Provides units for {@link HourAngle}s, where 24 hours make a revolution.  The canonical unit is
 * {@link #RADIANS}.
 */
public enum HourAngleUnit implements Unit<HourAngleUnit> {
  RADIANS("rad") {
    @Override public double toCanonical(double value) {
      return value;
    }

    @Override public double fromCanonical(double canonical) {
      return canonical;
    }
  },
  HOURS("h") {
    @Override public double toCanonical(double value) {
      return HourAngle.fromHours(value).radians();
    }

    @Override public double fromCanonical(double canonical) {
      return HourAngle.fromRadians(canonical).hours();
    }
  },
  MINUTES("m") {
    @Override public double toCanonical(double value) {
      return HourAngle.fromMinutes(value).radians();
    }

    @Override public double fromCanonical(double canonical) {
      return HourAngle.fromRadians(canonical).minutes();
    }
  },
  SECONDS("s") {
    @Override public double toCanonical(double value) {
      return HourAngle.fromSeconds(value).radians();
    }

    @Override public double fromCanonical(double canonical) {
      return HourAngle.fromRadians(canonical).seconds();
    }
  };

  private final String display;

  private HourAngleUnit(String display) {
    this.display = display;
  }

  @Override
  public String toString() {
    return display;
  }
}
