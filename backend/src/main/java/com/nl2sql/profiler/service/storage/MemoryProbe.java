package com.nl2sql.profiler.service.storage;

/** Source of the memory figure used to size persistence batches. */
@FunctionalInterface
public interface MemoryProbe {

  /** Bytes the JVM can still allocate. */
  long availableBytes();
}
