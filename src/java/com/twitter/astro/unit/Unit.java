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
 * Represents a unit hierarchy for one kind of circular quantity; eg: angles.  Instances represent
 * specific units from the hierarchy; eg: degrees.
 *
 * <p>Each hierarchy has a single canonical unit that its value type stores internally.  Conversions
 * go through the canonical unit and use the same formulas as the named factories and accessors on
 * the value types, so {@code Angle.of(d, AngleUnit.DEGREES)} and {@code Angle.fromDegrees(d)} are
 * numerically identical.
 *
 * @param <U> the type of the concrete unit implementation
 */
public interface Unit<U extends Unit<U>> {

  /**
   * Converts a value expressed in this unit into the canonical unit of the hierarchy.
   */
  double toCanonical(double value);

  /**
   * Converts a value expressed in the canonical unit of the hierarchy into this unit.
   */
  double fromCanonical(double canonical);
}
