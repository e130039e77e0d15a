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

package io.github.suppierk.lifecycle.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@link ProcessCatalog} over a fixed set of definitions, mostly for embedding and tests. */
public final class InMemoryProcessCatalog implements ProcessCatalog {
  private final Map<String, ProcessDefinition> processes;

  private InMemoryProcessCatalog(Map<String, ProcessDefinition> processes) {
    this.processes = Map.copyOf(processes);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Optional<ProcessDefinition> findProcess(String processId) {
    return Optional.ofNullable(processId).map(processes::get);
  }

  @Override
  public Optional<ProcessDefinition> findProcessOfStage(String stageId) {
    return processes.values().stream()
        .filter(process -> process.stage(stageId).isPresent())
        .findFirst();
  }

  @Override
  public Optional<ProcessDefinition> findDefaultProcess(String productId, ProcessType type) {
    return processes.values().stream()
        .filter(process -> process.productId().equals(productId))
        .filter(process -> process.type() == type)
        .filter(ProcessDefinition::published)
        .max(
            Comparator.comparingInt(ProcessDefinition::version)
                .thenComparing(ProcessDefinition::id, Comparator.reverseOrder()));
  }

  /** Collects processes with their stages. */
  public static final class Builder {
    private final Map<String, ProcessDefinition> processes = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Starts a published process of version 1.
     *
     * @return a builder for its stages
     */
    public ProcessBuilder process(String id, String productId, ProcessType type, String name) {
      return new ProcessBuilder(this, id, productId, type, name);
    }

    public Builder add(ProcessDefinition process) {
      if (processes.putIfAbsent(process.id(), process) != null) {
        throw new IllegalStateException("Process '%s' is already defined".formatted(process.id()));
      }
      return this;
    }

    public InMemoryProcessCatalog build() {
      return new InMemoryProcessCatalog(processes);
    }
  }

  /** Collects stages of a single process. */
  public static final class ProcessBuilder {
    private final Builder parent;
    private final String id;
    private final String productId;
    private final ProcessType type;
    private final String name;
    private final List<StageDefinition> stages = new ArrayList<>();
    private int version = 1;
    private boolean published = true;

    private ProcessBuilder(
        Builder parent, String id, String productId, ProcessType type, String name) {
      this.parent = parent;
      this.id = id;
      this.productId = productId;
      this.type = type;
      this.name = name;
    }

    public ProcessBuilder version(int version) {
      this.version = version;
      return this;
    }

    public ProcessBuilder draft() {
      this.published = false;
      return this;
    }

    public ProcessBuilder stage(String stageId, String stageName, int order) {
      return terminalStage(stageId, stageName, order, null);
    }

    public ProcessBuilder terminalStage(
        String stageId, String stageName, int order, TerminalOutcome outcome) {
      stages.add(new StageDefinition(stageId, id, stageName, order, outcome));
      return this;
    }

    public Builder done() {
      return parent.add(
          new ProcessDefinition(id, productId, type, name, version, published, stages));
    }
  }
}
