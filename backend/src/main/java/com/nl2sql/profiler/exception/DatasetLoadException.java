package com.nl2sql.profiler.exception;

import com.nl2sql.profiler.model.ProfilingStage;

/** The uploaded bytes could not be turned into a table: bad encoding, structure or format. */
public class DatasetLoadException extends ProfilingException {

  public DatasetLoadException(String message) {
    super(ProfilingStage.LOADING, message);
  }

  public DatasetLoadException(String message, Throwable cause) {
    super(ProfilingStage.LOADING, message, cause);
  }
}
