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

package io.github.suppierk.generator.event;

/** Kind of mutation a {@link DomainEvent} describes, stored as {@code modType} in its data. */
public enum ModificationType {
  CREATE,
  UPDATE_MERGE,
  UPDATE_REPLACE,
  DELETE;

  /** Key of the tag within {@link DomainEvent#data()}. */
  public static final String DATA_KEY = "modType";

  /**
   * @param merge flag of the update command
   * @return matching update modification
   */
  public static ModificationType ofUpdate(final boolean merge) {
    return merge ? UPDATE_MERGE : UPDATE_REPLACE;
  }
}
