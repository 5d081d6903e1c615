/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.generator.vehicle;

import io.github.suppierk.generator.async.DomainNotification;
import java.util.function.Predicate;

/** Filters of materialized-view subscriptions. */
public final class VehicleSubscriptions {
  /** Vehicle id matching every update, including deletions. */
  public static final String ANY = "ANY";

  private VehicleSubscriptions() {
    // Utility class
  }

  /**
   * @param vehicleId to follow, or {@link #ANY}
   * @return filter passing the updates of the vehicle, or all updates for {@link #ANY}
   */
  public static Predicate<DomainNotification<?, ?>> byVehicleId(final String vehicleId) {
    if (vehicleId == null || vehicleId.isBlank()) {
      throw new IllegalArgumentException("Vehicle id cannot be blank, use ANY to follow all");
    }

    if (ANY.equals(vehicleId)) {
      return notification -> true;
    }

    return notification ->
        notification.payload() instanceof Vehicle vehicle && vehicleId.equals(vehicle.id());
  }
}
