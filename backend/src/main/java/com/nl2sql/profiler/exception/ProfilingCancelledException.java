package com.nl2sql.profiler.exception;

import com.nl2sql.profiler.model.ProfilingStage;

public class ProfilingCancelledException extends ProfilingException {

  public ProfilingCancelledException(ProfilingStage stage) {
    super(stage, "Profiling run was cancelled during " + stage);
  }
}
