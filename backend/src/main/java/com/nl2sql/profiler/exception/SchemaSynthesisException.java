package com.nl2sql.profiler.exception;

import com.nl2sql.profiler.model.ProfilingStage;

/** No valid table definition can be produced for the optimized table. */
public class SchemaSynthesisException extends ProfilingException {

  public SchemaSynthesisException(String message) {
    super(ProfilingStage.SYNTHESIZING, message);
  }

  public SchemaSynthesisException(String message, Throwable cause) {
    super(ProfilingStage.SYNTHESIZING, message, cause);
  }
}
