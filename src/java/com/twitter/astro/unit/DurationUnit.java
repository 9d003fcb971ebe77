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
 * Provides units for {@link Time} durations.  The canonical unit is {@link #SECONDS}.
 */
public enum DurationUnit implements Unit<DurationUnit> {
  SECONDS("secs") {
    @Override public double toCanonical(double value) {
      return value;
    }

    @Override public double fromCanonical(double canonical) {
      return canonical;
    }
  },
  MINUTES("mins") {
    @Override public double toCanonical(double value) {
      return Time.fromMinutes(value).seconds();
    }

    @Override public double fromCanonical(double canonical) {
      return Time.fromSeconds(canonical).minutes();
    }
  },
  HOURS("hrs") {
    @Override public double toCanonical(double value) {
      return Time.fromHours(value).seconds();
    }

    @Override public double fromCanonical(double canonical) {
      return Time.fromSeconds(canonical).hours();
    }
  },
  DAYS("days") {
    @Override public double toCanonical(double value) {
      return Time.fromDays(value).seconds();
    }

    @Override public double fromCanonical(double canonical) {
      return Time.fromSeconds(canonical).days();
    }
  };

  private final String display;

  private DurationUnit(String display) {
    this.display = display;
  }

  @Override
  public String toString() {
    return display;
  }
}
