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

/**
 * Command and query plumbing shared by the aggregates of the service.
 *
 * <p>How the pieces relate, taking a fleet operator renaming a vehicle as an example:
 *
 * <ul>
 *   <li>The operator is a {@link io.github.suppierk.generator.authorization.DomainClient}, the
 *       generation engine publishing on its own is not one, it never goes through this package.
 *   <li>Renaming is a {@link io.github.suppierk.generator.cqrs.DomainCommand.Update}:
 *       <ul>
 *         <li>its handler writes the vehicle row and appends one {@code VehicleModified} event in
 *             the same transaction, so either both are committed or neither is;
 *         <li>after the commit it hands the renamed vehicle to the fanout dispatcher, which
 *             publishes it on the materialized-view topic without the operator waiting for it.
 *       </ul>
 *   <li>Looking the vehicle up afterwards is a {@link
 *       io.github.suppierk.generator.cqrs.DomainQuery.One}, listing the fleet a {@link
 *       io.github.suppierk.generator.cqrs.DomainQuery.Many} answered with a {@link
 *       io.github.suppierk.generator.cqrs.Listing}.
 *   <li>The handlers of one aggregate form a {@link
 *       io.github.suppierk.generator.cqrs.BoundedContext}, which picks the handler by message
 *       class.
 *   <li>Failures are {@link io.github.suppierk.generator.cqrs.DomainException}s carrying the status
 *       code the gateway answers with.
 * </ul>
 */
package io.github.suppierk.generator.cqrs;
