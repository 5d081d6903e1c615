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

package io.github.suppierk.generator;

import io.github.suppierk.generator.authorization.DomainClient;
import io.github.suppierk.generator.cqrs.CommandResult;
import io.github.suppierk.generator.cqrs.Listing;
import io.github.suppierk.generator.generation.GenerationEngine;
import io.github.suppierk.generator.generation.GenerationStatus;
import io.github.suppierk.generator.vehicle.Pagination;
import io.github.suppierk.generator.vehicle.Vehicle;
import io.github.suppierk.generator.vehicle.VehicleContext;
import io.github.suppierk.generator.vehicle.VehicleFilter;
import io.github.suppierk.generator.vehicle.VehicleInput;
import io.github.suppierk.generator.vehicle.VehicleSort;
import java.util.List;

/**
 * Operations exposed to the gateway.
 *
 * <p>Vehicle operations fail with {@link io.github.suppierk.generator.cqrs.DomainException}s
 * carrying a status code. Generation control never throws on misuse, it answers with an
 * unsuccessful {@link CommandResult} instead.
 */
public final class VehicleGeneratorService {
  private final VehicleContext vehicles;
  private final GenerationEngine generation;

  /**
   * @param vehicles processing vehicle commands and queries
   * @param generation producing random vehicles
   */
  public VehicleGeneratorService(final VehicleContext vehicles, final GenerationEngine generation) {
    if (vehicles == null || generation == null) {
      throw new IllegalArgumentException("Vehicle context and generation engine are required");
    }

    this.vehicles = vehicles;
    this.generation = generation;
  }

  public Vehicle createVehicle(final DomainClient actor, final VehicleInput input) {
    return vehicles.create(actor, input);
  }

  /**
   * @param merge {@code true} to keep the fields absent from the input, {@code false} to reset them
   */
  public Vehicle updateVehicle(
      final DomainClient actor, final String id, final VehicleInput input, final boolean merge) {
    return vehicles.update(actor, id, input, merge);
  }

  /**
   * @return {@code 200} if at least one vehicle was deleted, {@code 400} otherwise
   */
  public CommandResult deleteVehicles(final DomainClient actor, final List<String> ids) {
    return vehicles.delete(actor, ids);
  }

  /**
   * @param filter may be {@code null} to match every vehicle
   * @param pagination may be {@code null} for the first 10 vehicles
   * @param sort may be {@code null} for the newest vehicles first
   */
  public Listing<Vehicle> listVehicles(
      final DomainClient actor,
      final VehicleFilter filter,
      final Pagination pagination,
      final VehicleSort sort) {
    return vehicles.list(actor, filter, pagination, sort);
  }

  public Vehicle getVehicle(
      final DomainClient actor, final String id, final String organizationId) {
    return vehicles.get(actor, id, organizationId);
  }

  public CommandResult startGeneration() {
    return generation.start();
  }

  public CommandResult stopGeneration() {
    return generation.stop();
  }

  public GenerationStatus getGenerationStatus() {
    return generation.status();
  }
}
