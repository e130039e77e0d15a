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

import java.math.BigDecimal;
import java.time.Instant;

/**
 * State of a company product as produced by folding its events, also the shape of its read model
 * row.
 *
 * <p>{@code lastAppliedSequenceNo} is the watermark: the highest sequence number folded into this
 * state, {@code 0} for an aggregate without history.
 */
public record CompanyProductState(
    String aggregateId,
    String companyId,
    String productId,
    LifecyclePhase phase,
    ProcessStatus status,
    String currentProcessId,
    ProcessType currentProcessType,
    String currentStageId,
    String currentStageName,
    Integer currentStageOrder,
    Instant stageEnteredAt,
    Instant lastStageMovedAt,
    Instant processStartedAt,
    Instant processCompletedAt,
    TerminalOutcome terminalOutcome,
    int stageTransitionCount,
    String ownerId,
    String ownerName,
    Integer tier,
    BigDecimal mrr,
    String mrrCurrency,
    Integer seats,
    String nextStep,
    Instant nextStepDueAt,
    Integer closeConfidence,
    boolean closeReady,
    String churnReason,
    LifecycleEventType lastEventType,
    Instant lastEventAt,
    long lastAppliedSequenceNo) {

  public CompanyProductState {
    if (aggregateId == null || companyId == null || productId == null) {
      throw new IllegalArgumentException("Aggregate identity cannot be null");
    }
    if (phase == null || status == null) {
      throw new IllegalArgumentException("Phase and status cannot be null");
    }
  }

  /**
   * @param ref identity of the aggregate
   * @return state of an aggregate before its first event
   */
  public static CompanyProductState initial(AggregateRef ref) {
    return new Builder(ref).build();
  }

  public AggregateRef ref() {
    return new AggregateRef(aggregateId, companyId, productId);
  }

  /**
   * @return {@code true} if no event has been folded yet
   */
  public boolean isNew() {
    return lastAppliedSequenceNo == 0;
  }

  /**
   * A process is active while it is in progress and matches the phase the aggregate is in. A
   * phase override leaves the old process behind without an active workflow.
   *
   * @return {@code true} if stage commands may operate on the current process
   */
  public boolean hasActiveProcess() {
    return status == ProcessStatus.IN_PROGRESS
        && currentProcessType != null
        && currentProcessType.phase() == phase;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Mutable companion used by the fold. */
  public static final class Builder {
    private final String aggregateId;
    private final String companyId;
    private final String productId;
    private LifecyclePhase phase = LifecyclePhase.PROSPECT;
    private ProcessStatus status = ProcessStatus.NONE;
    private String currentProcessId;
    private ProcessType currentProcessType;
    private String currentStageId;
    private String currentStageName;
    private Integer currentStageOrder;
    private Instant stageEnteredAt;
    private Instant lastStageMovedAt;
    private Instant processStartedAt;
    private Instant processCompletedAt;
    private TerminalOutcome terminalOutcome;
    private int stageTransitionCount;
    private String ownerId;
    private String ownerName;
    private Integer tier;
    private BigDecimal mrr;
    private String mrrCurrency;
    private Integer seats;
    private String nextStep;
    private Instant nextStepDueAt;
    private Integer closeConfidence;
    private boolean closeReady;
    private String churnReason;
    private LifecycleEventType lastEventType;
    private Instant lastEventAt;
    private long lastAppliedSequenceNo;

    public Builder(AggregateRef ref) {
      this.aggregateId = ref.aggregateId();
      this.companyId = ref.companyId();
      this.productId = ref.productId();
    }

    private Builder(CompanyProductState state) {
      this.aggregateId = state.aggregateId;
      this.companyId = state.companyId;
      this.productId = state.productId;
      this.phase = state.phase;
      this.status = state.status;
      this.currentProcessId = state.currentProcessId;
      this.currentProcessType = state.currentProcessType;
      this.currentStageId = state.currentStageId;
      this.currentStageName = state.currentStageName;
      this.currentStageOrder = state.currentStageOrder;
      this.stageEnteredAt = state.stageEnteredAt;
      this.lastStageMovedAt = state.lastStageMovedAt;
      this.processStartedAt = state.processStartedAt;
      this.processCompletedAt = state.processCompletedAt;
      this.terminalOutcome = state.terminalOutcome;
      this.stageTransitionCount = state.stageTransitionCount;
      this.ownerId = state.ownerId;
      this.ownerName = state.ownerName;
      this.tier = state.tier;
      this.mrr = state.mrr;
      this.mrrCurrency = state.mrrCurrency;
      this.seats = state.seats;
      this.nextStep = state.nextStep;
      this.nextStepDueAt = state.nextStepDueAt;
      this.closeConfidence = state.closeConfidence;
      this.closeReady = state.closeReady;
      this.churnReason = state.churnReason;
      this.lastEventType = state.lastEventType;
      this.lastEventAt = state.lastEventAt;
      this.lastAppliedSequenceNo = state.lastAppliedSequenceNo;
    }

    public Builder phase(LifecyclePhase phase) {
      this.phase = phase;
      return this;
    }

    public Builder status(ProcessStatus status) {
      this.status = status;
      return this;
    }

    public Builder currentProcess(String processId, ProcessType processType) {
      this.currentProcessId = processId;
      this.currentProcessType = processType;
      return this;
    }

    public Builder currentStage(String stageId, String stageName, Integer stageOrder) {
      this.currentStageId = stageId;
      this.currentStageName = stageName;
      this.currentStageOrder = stageOrder;
      return this;
    }

    public Builder stageEnteredAt(Instant stageEnteredAt) {
      this.stageEnteredAt = stageEnteredAt;
      return this;
    }

    public Builder lastStageMovedAt(Instant lastStageMovedAt) {
      this.lastStageMovedAt = lastStageMovedAt;
      return this;
    }

    public Builder processStartedAt(Instant processStartedAt) {
      this.processStartedAt = processStartedAt;
      return this;
    }

    public Builder processCompletedAt(Instant processCompletedAt) {
      this.processCompletedAt = processCompletedAt;
      return this;
    }

    public Builder terminalOutcome(TerminalOutcome terminalOutcome) {
      this.terminalOutcome = terminalOutcome;
      return this;
    }

    public Builder stageTransitionCount(int stageTransitionCount) {
      this.stageTransitionCount = stageTransitionCount;
      return this;
    }

    public Builder owner(String ownerId, String ownerName) {
      this.ownerId = ownerId;
      this.ownerName = ownerName;
      return this;
    }

    public Builder tier(Integer tier) {
      this.tier = tier;
      return this;
    }

    public Builder mrr(BigDecimal mrr, String mrrCurrency) {
      this.mrr = mrr;
      this.mrrCurrency = mrrCurrency;
      return this;
    }

    public Builder seats(Integer seats) {
      this.seats = seats;
      return this;
    }

    public Builder nextStep(String nextStep, Instant nextStepDueAt) {
      this.nextStep = nextStep;
      this.nextStepDueAt = nextStepDueAt;
      return this;
    }

    public Builder closeConfidence(Integer closeConfidence, boolean closeReady) {
      this.closeConfidence = closeConfidence;
      this.closeReady = closeReady;
      return this;
    }

    public Builder churnReason(String churnReason) {
      this.churnReason = churnReason;
      return this;
    }

    public Builder lastEvent(LifecycleEventType type, Instant at, long sequenceNo) {
      this.lastEventType = type;
      this.lastEventAt = at;
      this.lastAppliedSequenceNo = sequenceNo;
      return this;
    }

    public CompanyProductState build() {
      return new CompanyProductState(
          aggregateId,
          companyId,
          productId,
          phase,
          status,
          currentProcessId,
          currentProcessType,
          currentStageId,
          currentStageName,
          currentStageOrder,
          stageEnteredAt,
          lastStageMovedAt,
          processStartedAt,
          processCompletedAt,
          terminalOutcome,
          stageTransitionCount,
          ownerId,
          ownerName,
          tier,
          mrr,
          mrrCurrency,
          seats,
          nextStep,
          nextStepDueAt,
          closeConfidence,
          closeReady,
          churnReason,
          lastEventType,
          lastEventAt,
          lastAppliedSequenceNo);
    }
  }
}
