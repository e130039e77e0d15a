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

import io.github.suppierk.lifecycle.config.LifecycleConfig;
import io.github.suppierk.lifecycle.errors.InvariantViolationException;
import io.github.suppierk.lifecycle.errors.LifecycleException;
import io.github.suppierk.lifecycle.errors.NotFoundException;
import io.github.suppierk.lifecycle.errors.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which events a command produces for the current state of a company product.
 *
 * <p>Every method either returns the events to append, an empty list when the aggregate already
 * is in the requested state, or throws a {@link LifecycleException} describing why the command
 * is illegal. Nothing here performs I/O besides
 * read-only catalog lookups.
 *
 * <p>Phase graph for manual overrides:
 *
 * <pre>
 * prospect   -> churned
 * in_sales   -> prospect | churned
 * onboarding -> active | churned
 * active     -> churned
 * churned    -> prospect | active
 * </pre>
 *
 * Forward moves out of a running process happen through process completion only.
 */
public final class LifecycleStateMachine {
  private static final Map<LifecyclePhase, Set<LifecyclePhase>> PHASE_OVERRIDES =
      new EnumMap<>(LifecyclePhase.class);

  static {
    PHASE_OVERRIDES.put(LifecyclePhase.PROSPECT, EnumSet.of(LifecyclePhase.CHURNED));
    PHASE_OVERRIDES.put(
        LifecyclePhase.IN_SALES, EnumSet.of(LifecyclePhase.PROSPECT, LifecyclePhase.CHURNED));
    PHASE_OVERRIDES.put(
        LifecyclePhase.ONBOARDING, EnumSet.of(LifecyclePhase.ACTIVE, LifecyclePhase.CHURNED));
    PHASE_OVERRIDES.put(LifecyclePhase.ACTIVE, EnumSet.of(LifecyclePhase.CHURNED));
    PHASE_OVERRIDES.put(
        LifecyclePhase.CHURNED, EnumSet.of(LifecyclePhase.PROSPECT, LifecyclePhase.ACTIVE));
  }

  private static final Set<LifecyclePhase> STAGE_PHASES =
      EnumSet.of(LifecyclePhase.IN_SALES, LifecyclePhase.ONBOARDING, LifecyclePhase.ACTIVE);

  private static final Pattern CURRENCY = Pattern.compile("[A-Z]{3}");

  private final ProcessCatalog catalog;
  private final LifecycleConfig.Policy policy;

  public LifecycleStateMachine(ProcessCatalog catalog, LifecycleConfig.Policy policy) {
    if (catalog == null || policy == null) {
      throw new IllegalArgumentException("Process catalog and policy cannot be null");
    }
    if (policy.salesWonPhase() != LifecyclePhase.ONBOARDING
        && policy.salesWonPhase() != LifecyclePhase.ACTIVE) {
      throw new IllegalStateException(
          "Sales won phase must be onboarding or active, got '%s'"
              .formatted(policy.salesWonPhase().wireName()));
    }
    if (policy.minTier() > policy.maxTier()) {
      throw new IllegalStateException("Minimum tier cannot exceed maximum tier");
    }

    this.catalog = catalog;
    this.policy = policy;
  }

  public List<LifecycleEvent> startSale(
      CompanyProductState state, String processId, String initialStageId) {
    requireNotChurned(state, "start a sale");

    if (state.phase() == LifecyclePhase.IN_SALES
        && state.hasActiveProcess()
        && Objects.equals(processId, state.currentProcessId())
        && Objects.equals(initialStageId, state.currentStageId())) {
      return List.of();
    }
    if (state.phase() != LifecyclePhase.PROSPECT) {
      throw new InvariantViolationException(
          "Cannot start a sale for aggregate '%s' in phase '%s'"
              .formatted(state.aggregateId(), state.phase().wireName()));
    }

    final ProcessDefinition process = productProcess(state, processId);
    if (process.type() != ProcessType.SALES) {
      throw new InvariantViolationException(
          "Process '%s' is a %s process, a sale needs a sales process"
              .formatted(process.id(), process.type().wireName()));
    }

    final StageDefinition stage = stageOf(process, initialStageId);
    if (stage.isTerminal()) {
      throw new InvariantViolationException(
          "Stage '%s' is terminal, a sale cannot start there".formatted(stage.id()));
    }

    return List.of(
        new LifecycleEvent.SaleStarted(
            process.id(),
            process.version(),
            stage.id(),
            stage.name(),
            stage.stageOrder(),
            state.phase(),
            LifecyclePhase.IN_SALES));
  }

  /**
   * Starts a process on an aggregate that has none running, such as one whose sale was won by a
   * plain completion or whose phase was overridden. The process type must belong to the current
   * phase, so this never moves the phase.
   *
   * @param initialStageId optional, the first stage of the process when absent
   */
  public List<LifecycleEvent> startProcess(
      CompanyProductState state, String processId, String initialStageId) {
    requireNotChurned(state, "start a process");

    if (state.hasActiveProcess()) {
      if (Objects.equals(processId, state.currentProcessId())
          && (initialStageId == null || initialStageId.equals(state.currentStageId()))) {
        return List.of();
      }
      throw new InvariantViolationException(
          "Aggregate '%s' already runs process '%s'"
              .formatted(state.aggregateId(), state.currentProcessId()));
    }

    final ProcessDefinition process = productProcess(state, processId);
    if (process.type().phase() != state.phase()) {
      throw new InvariantViolationException(
          "A %s process cannot start on aggregate '%s' in phase '%s'"
              .formatted(
                  process.type().wireName(), state.aggregateId(), state.phase().wireName()));
    }

    final StageDefinition stage =
        initialStageId == null
            ? process
                .initialStage()
                .orElseThrow(
                    () ->
                        new NotFoundException(
                            "Process '%s' has no initial stage".formatted(process.id())))
            : stageOf(process, initialStageId);
    if (stage.isTerminal()) {
      throw new InvariantViolationException(
          "Stage '%s' is terminal, a process cannot start there".formatted(stage.id()));
    }

    return List.of(
        new LifecycleEvent.ProcessStarted(
            process.id(),
            process.type(),
            process.version(),
            stage.id(),
            stage.name(),
            stage.stageOrder(),
            state.phase(),
            state.phase()));
  }

  /**
   * @param trigger what moved the aggregate, {@link StageTrigger#MANUAL} when absent
   */
  public List<LifecycleEvent> advanceStage(
      CompanyProductState state, String toStageId, String reason, StageTrigger trigger) {
    requireNotChurned(state, "advance a stage");

    if (!STAGE_PHASES.contains(state.phase()) || !state.hasActiveProcess()) {
      throw new InvariantViolationException(
          "Aggregate '%s' has no active process to advance".formatted(state.aggregateId()));
    }

    final ProcessDefinition process = process(state.currentProcessId());
    final StageDefinition stage = stageOf(process, toStageId);

    if (stage.id().equals(state.currentStageId())) {
      return List.of();
    }
    if (stage.isTerminal()) {
      throw new InvariantViolationException(
          "Stage '%s' is terminal, complete the process instead".formatted(stage.id()));
    }

    final Integer fromOrder = state.currentStageOrder();
    return List.of(
        new LifecycleEvent.StageAdvanced(
            state.currentStageId(),
            state.currentStageName(),
            fromOrder,
            stage.id(),
            stage.name(),
            stage.stageOrder(),
            fromOrder == null || stage.stageOrder() > fromOrder,
            reason,
            trigger == null ? StageTrigger.MANUAL : trigger));
  }

  public List<LifecycleEvent> setPhase(
      CompanyProductState state, LifecyclePhase toPhase, String reason, String churnReason) {
    if (toPhase == state.phase()) {
      return List.of();
    }
    if (!PHASE_OVERRIDES.get(state.phase()).contains(toPhase)) {
      throw new InvariantViolationException(
          "Phase of aggregate '%s' cannot change from '%s' to '%s'"
              .formatted(state.aggregateId(), state.phase().wireName(), toPhase.wireName()));
    }

    return List.of(
        new LifecycleEvent.PhaseChanged(
            state.phase(),
            toPhase,
            reason,
            toPhase == LifecyclePhase.CHURNED ? churnReason : null));
  }

  public List<LifecycleEvent> setOwner(
      CompanyProductState state, String ownerId, String ownerName, String reason) {
    requireAttributesMutable(state, true);

    if (Objects.equals(ownerId, state.ownerId()) && Objects.equals(ownerName, state.ownerName())) {
      return List.of();
    }

    return List.of(
        new LifecycleEvent.OwnerChanged(
            state.ownerId(), state.ownerName(), ownerId, ownerName, reason));
  }

  public List<LifecycleEvent> setTier(CompanyProductState state, int tier, String reason) {
    requireAttributesMutable(state, false);

    if (tier < policy.minTier() || tier > policy.maxTier()) {
      throw new ValidationException(
          "Tier must be between %d and %d, got %d"
              .formatted(policy.minTier(), policy.maxTier(), tier));
    }
    if (Objects.equals(state.tier(), tier)) {
      return List.of();
    }

    return List.of(new LifecycleEvent.TierChanged(state.tier(), tier, reason));
  }

  public List<LifecycleEvent> setMrr(
      CompanyProductState state, BigDecimal mrr, String currency, String reason) {
    requireAttributesMutable(state, false);

    if (mrr.signum() < 0) {
      throw new ValidationException("MRR cannot be negative, got %s".formatted(mrr));
    }

    final BigDecimal normalizedMrr = mrr.setScale(2, RoundingMode.HALF_UP);
    if (normalizedMrr.compareTo(FieldLimits.MAX_MRR) > 0) {
      throw new ValidationException(
          "MRR cannot exceed %s, got %s".formatted(FieldLimits.MAX_MRR.toPlainString(), mrr));
    }
    final String normalizedCurrency =
        currency == null || currency.isBlank()
            ? policy.defaultCurrency()
            : currency.trim().toUpperCase(Locale.ROOT);
    if (!CURRENCY.matcher(normalizedCurrency).matches()) {
      throw new ValidationException(
          "Currency must be a three-letter code, got '%s'".formatted(currency));
    }

    if (state.mrr() != null
        && state.mrr().compareTo(normalizedMrr) == 0
        && normalizedCurrency.equals(state.mrrCurrency())) {
      return List.of();
    }

    return List.of(
        new LifecycleEvent.MrrChanged(state.mrr(), normalizedMrr, normalizedCurrency, reason));
  }

  public List<LifecycleEvent> setSeats(CompanyProductState state, int seats, String reason) {
    requireAttributesMutable(state, false);

    if (seats < 0) {
      throw new ValidationException("Seats cannot be negative, got %d".formatted(seats));
    }
    if (Objects.equals(state.seats(), seats)) {
      return List.of();
    }

    return List.of(new LifecycleEvent.SeatsChanged(state.seats(), seats, reason));
  }

  /**
   * Due instants in the past are accepted and flagged as overdue.
   *
   * @param now instant the command is decided at
   */
  public List<LifecycleEvent> setNextStepDue(
      CompanyProductState state, String nextStep, Instant dueAt, Instant now) {
    requireAttributesMutable(state, false);

    final String normalizedStep = nextStep.trim();
    if (normalizedStep.equals(state.nextStep()) && dueAt.equals(state.nextStepDueAt())) {
      return List.of();
    }

    return List.of(
        new LifecycleEvent.NextStepScheduled(
            state.nextStep(),
            state.nextStepDueAt(),
            normalizedStep,
            dueAt,
            dueAt.isBefore(now)));
  }

  public List<LifecycleEvent> setCloseConfidence(CompanyProductState state, int confidence) {
    requireAttributesMutable(state, false);

    if (confidence < 0 || confidence > 100) {
      throw new ValidationException(
          "Close confidence must be between 0 and 100, got %d".formatted(confidence));
    }
    if (Objects.equals(state.closeConfidence(), confidence)) {
      return List.of();
    }

    return List.of(
        new LifecycleEvent.CloseConfidenceChanged(
            state.closeConfidence(),
            confidence,
            confidence >= policy.readyToCloseConfidence()));
  }

  /**
   * Completes the current process at a terminal stage and moves the phase where the outcome
   * leads:
   *
   * <ul>
   *   <li>sales won: the configured sales won phase
   *   <li>sales lost or cancelled: back to prospect
   *   <li>onboarding completed: active
   *   <li>onboarding or engagement lost, churned or cancelled: churned
   *   <li>engagement completed: unchanged
   * </ul>
   *
   * @param processId optional guard, must match the current process when present
   * @param now instant the command is decided at
   */
  public List<LifecycleEvent> completeProcess(
      CompanyProductState state,
      String processId,
      String terminalStageId,
      TerminalOutcome outcome,
      String notes,
      Instant now) {
    requireNotChurned(state, "complete a process");

    if (!state.hasActiveProcess()) {
      throw new InvariantViolationException(
          "Aggregate '%s' has no active process to complete".formatted(state.aggregateId()));
    }
    if (processId != null && !processId.equals(state.currentProcessId())) {
      throw new InvariantViolationException(
          "Process '%s' is not the current process '%s' of aggregate '%s'"
              .formatted(processId, state.currentProcessId(), state.aggregateId()));
    }

    final ProcessDefinition process = process(state.currentProcessId());
    final StageDefinition stage = stageOf(process, terminalStageId);
    if (stage.terminalType() != outcome) {
      throw new InvariantViolationException(
          "Stage '%s' is not a terminal stage marked '%s'"
              .formatted(stage.id(), outcome.wireName()));
    }

    final LifecyclePhase target = phaseAfter(process, outcome);
    final List<LifecycleEvent> events = new ArrayList<>(2);
    events.add(completed(state, process, stage, notes, now));

    if (target != state.phase()) {
      final String defaultChurnReason =
          "%s process ended as %s".formatted(process.type().wireName(), outcome.wireName());
      final String churnReason =
          target == LifecyclePhase.CHURNED
              ? Objects.requireNonNullElse(notes, defaultChurnReason)
              : null;
      events.add(
          new LifecycleEvent.PhaseChanged(
              state.phase(),
              target,
              "Process '%s' completed as %s".formatted(process.id(), outcome.wireName()),
              churnReason));
    }

    return List.copyOf(events);
  }

  public List<LifecycleEvent> completeSaleAndStartOnboarding(
      CompanyProductState state, String onboardingProcessId, String notes, Instant now) {
    return completeAndStartNext(
        state,
        ProcessType.SALES,
        TerminalOutcome.WON,
        ProcessType.ONBOARDING,
        onboardingProcessId,
        notes,
        now);
  }

  public List<LifecycleEvent> completeOnboardingAndStartEngagement(
      CompanyProductState state, String engagementProcessId, String notes, Instant now) {
    return completeAndStartNext(
        state,
        ProcessType.ONBOARDING,
        TerminalOutcome.COMPLETED,
        ProcessType.ENGAGEMENT,
        engagementProcessId,
        notes,
        now);
  }

  /** Both events are resolved before anything is returned, so a failure yields neither. */
  private List<LifecycleEvent> completeAndStartNext(
      CompanyProductState state,
      ProcessType currentType,
      TerminalOutcome outcome,
      ProcessType nextType,
      String nextProcessId,
      String notes,
      Instant now) {
    requireNotChurned(state, "complete a process");

    if (!state.hasActiveProcess() || state.currentProcessType() != currentType) {
      throw new InvariantViolationException(
          "Aggregate '%s' has no active %s process to complete"
              .formatted(state.aggregateId(), currentType.wireName()));
    }

    final ProcessDefinition current = process(state.currentProcessId());
    final StageDefinition terminal =
        current
            .terminalStage(outcome)
            .orElseThrow(
                () ->
                    new NotFoundException(
                        "Process '%s' has no stage marked '%s'"
                            .formatted(current.id(), outcome.wireName())));

    final ProcessDefinition next =
        nextProcessId == null
            ? catalog
                .findDefaultProcess(state.productId(), nextType)
                .orElseThrow(
                    () ->
                        new NotFoundException(
                            "Product '%s' has no published %s process"
                                .formatted(state.productId(), nextType.wireName())))
            : productProcess(state, nextProcessId);
    if (next.type() != nextType) {
      throw new InvariantViolationException(
          "Process '%s' is a %s process, expected %s"
              .formatted(next.id(), next.type().wireName(), nextType.wireName()));
    }

    final StageDefinition initial =
        next.initialStage()
            .orElseThrow(
                () ->
                    new NotFoundException(
                        "Process '%s' has no initial stage".formatted(next.id())));

    return List.of(
        completed(state, current, terminal, notes, now),
        new LifecycleEvent.ProcessStarted(
            next.id(),
            next.type(),
            next.version(),
            initial.id(),
            initial.name(),
            initial.stageOrder(),
            state.phase(),
            nextType.phase()));
  }

  private LifecycleEvent.ProcessCompleted completed(
      CompanyProductState state,
      ProcessDefinition process,
      StageDefinition terminal,
      String notes,
      Instant now) {
    final long durationDays =
        state.processStartedAt() == null
            ? 0
            : Math.max(0, Duration.between(state.processStartedAt(), now).toDays());

    return new LifecycleEvent.ProcessCompleted(
        process.id(),
        process.type(),
        terminal.id(),
        terminal.name(),
        terminal.stageOrder(),
        terminal.terminalType(),
        durationDays,
        state.stageTransitionCount(),
        notes);
  }

  private LifecyclePhase phaseAfter(ProcessDefinition process, TerminalOutcome outcome) {
    final ProcessType type = process.type();

    if (outcome == TerminalOutcome.WON) {
      if (type == ProcessType.SALES) {
        return policy.salesWonPhase();
      }
    } else if (outcome == TerminalOutcome.COMPLETED) {
      if (type == ProcessType.ONBOARDING || type == ProcessType.ENGAGEMENT) {
        return LifecyclePhase.ACTIVE;
      }
    } else if (type == ProcessType.SALES) {
      if (outcome != TerminalOutcome.CHURNED) {
        return LifecyclePhase.PROSPECT;
      }
    } else {
      return LifecyclePhase.CHURNED;
    }

    throw new InvariantViolationException(
        "A %s process cannot end as %s".formatted(type.wireName(), outcome.wireName()));
  }

  private ProcessDefinition process(String processId) {
    return catalog
        .findProcess(processId)
        .orElseThrow(
            () -> new NotFoundException("Process '%s' does not exist".formatted(processId)));
  }

  private ProcessDefinition productProcess(CompanyProductState state, String processId) {
    final ProcessDefinition process = process(processId);
    if (!process.productId().equals(state.productId())) {
      throw new InvariantViolationException(
          "Process '%s' belongs to product '%s', not '%s'"
              .formatted(process.id(), process.productId(), state.productId()));
    }

    return process;
  }

  private StageDefinition stageOf(ProcessDefinition process, String stageId) {
    return process
        .stage(stageId)
        .<LifecycleException>orElseThrow(
            () -> {
              if (catalog.findProcessOfStage(stageId).isPresent()) {
                return new InvariantViolationException(
                    "Stage '%s' does not belong to process '%s'".formatted(stageId, process.id()));
              }
              return new NotFoundException("Stage '%s' does not exist".formatted(stageId));
            });
  }

  private static void requireNotChurned(CompanyProductState state, String action) {
    if (state.phase().isTerminal()) {
      throw new InvariantViolationException(
          "Cannot %s for aggregate '%s', it has churned".formatted(action, state.aggregateId()));
    }
  }

  private void requireAttributesMutable(CompanyProductState state, boolean ownerChange) {
    if (!state.phase().isTerminal()) {
      return;
    }

    final TerminalAttributePolicy terminalPolicy = policy.terminalAttributePolicy();
    if (terminalPolicy == TerminalAttributePolicy.ALLOW_ALL
        || (terminalPolicy == TerminalAttributePolicy.OWNER_ONLY && ownerChange)) {
      return;
    }

    throw new InvariantViolationException(
        "Aggregate '%s' has churned, policy %s rejects this change"
            .formatted(state.aggregateId(), terminalPolicy.name().toLowerCase(Locale.ROOT)));
  }
}
