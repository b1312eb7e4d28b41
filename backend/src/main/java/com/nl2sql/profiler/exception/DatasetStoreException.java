package com.nl2sql.profiler.exception;

import com.nl2sql.profiler.model.ProfilingStage;

/** The persistence handoff failed; nothing from the run is left visible in the store. */
public class DatasetStoreException extends ProfilingException {

  public DatasetStoreException(String message, Throwable cause) {
    super(ProfilingStage.STORING, message, cause);
  }
}
