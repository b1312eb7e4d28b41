package com.nl2sql.profiler.model;

public enum ProfilingStage {
  IDLE,
  LOADING,
  OPTIMIZING,
  ANALYZING,
  SYNTHESIZING,
  ENRICHING,
  STORING,
  COMPLETE,
  FAILED
}
