package com.nl2sql.profiler.exception;

import com.nl2sql.profiler.model.ProfilingStage;

import lombok.Getter;

/**
 * Statistics for a single column could not be computed. The orchestrator isolates this failure to
 * the column instead of aborting the run.
 */
@Getter
public class ColumnAnalysisException extends ProfilingException {

  private final String columnName;

  public ColumnAnalysisException(String columnName, String message, Throwable cause) {
    super(ProfilingStage.ANALYZING, message, cause);
    this.columnName = columnName;
  }
}
