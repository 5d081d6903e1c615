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

package io.github.suppierk.generator.generation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only snapshot of the generation engine.
 *
 * @param isGenerating whether a run is active
 * @param generatedCount records produced by the current run, or by the last one if stopped
 */
public record GenerationStatus(
    @JsonProperty("isGenerating") boolean isGenerating,
    @JsonProperty("generatedCount") long generatedCount) {
  static final String RUNNING = "running";
  static final String STOPPED = "stopped";

  @JsonProperty("status")
  public String status() {
    return isGenerating ? RUNNING : STOPPED;
  }
}
