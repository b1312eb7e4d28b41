package com.nl2sql.profiler.service;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import com.nl2sql.profiler.dto.profile.DatasetProfile;
import com.nl2sql.profiler.exception.ProfilingCancelledException;
import com.nl2sql.profiler.model.ProfilingStage;

import lombok.Getter;

/**
 * Handle of one profiling run. The run can be cancelled as a unit until it starts handing data to
 * the store; from then on {@link #cancel()} has no effect.
 */
public class ProfilingRun {

  @Getter private final String runId;
  @Getter private final String fileName;

  private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
  private volatile ProfilingStage stage = ProfilingStage.IDLE;
  private volatile CompletableFuture<DatasetProfile> result;
  private boolean cancelled;
  private boolean persisting;

  ProfilingRun(String runId, String fileName) {
    this.runId = runId;
    this.fileName = fileName;
  }

  /**
   * Requests cancellation. In-flight column tasks are cancelled and their results discarded.
   *
   * @return false if the persistence handoff has already started
   */
  public boolean cancel() {
    synchronized (this) {
      if (persisting) {
        return false;
      }
      cancelled = true;
    }
    inFlight.forEach(future -> future.cancel(true));
    return true;
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public ProfilingStage getStage() {
    return stage;
  }

  /** Completes with the profile, or exceptionally with the run's terminal error. */
  public CompletableFuture<DatasetProfile> getResult() {
    return result;
  }

  void setResult(CompletableFuture<DatasetProfile> result) {
    this.result = result;
  }

  void setStage(ProfilingStage stage) {
    this.stage = stage;
  }

  void checkCancelled() {
    if (isCancelled()) {
      throw new ProfilingCancelledException(stage);
    }
  }

  /** Marks the start of the persistence handoff unless the run was cancelled first. */
  synchronized boolean beginPersisting() {
    if (cancelled) {
      return false;
    }
    persisting = true;
    return true;
  }

  void track(CompletableFuture<?> future) {
    inFlight.add(future);
    future.whenComplete((value, error) -> inFlight.remove(future));
  }
}
