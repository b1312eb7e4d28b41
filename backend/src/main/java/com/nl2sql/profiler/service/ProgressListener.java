package com.nl2sql.profiler.service;

import com.nl2sql.profiler.model.ProfilingStage;

/** Receives stage transitions of a profiling run. Calls are best-effort. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (stage, percent, message) -> {};

  void onProgress(ProfilingStage stage, int percent, String message);
}
