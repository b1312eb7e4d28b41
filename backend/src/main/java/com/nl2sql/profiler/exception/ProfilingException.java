package com.nl2sql.profiler.exception;

import com.nl2sql.profiler.model.ProfilingStage;

import lombok.Getter;

/** Terminal failure of a profiling run. Carries the stage the run was in when it failed. */
@Getter
public class ProfilingException extends RuntimeException {

  private final ProfilingStage stage;

  public ProfilingException(ProfilingStage stage, String message) {
    super(message);
    this.stage = stage;
  }

  public ProfilingException(ProfilingStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }
}
