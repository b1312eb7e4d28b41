package com.nl2sql.profiler.service.storage;

import org.springframework.stereotype.Component;

@Component
public class RuntimeMemoryProbe implements MemoryProbe {

  @Override
  public long availableBytes() {
    Runtime runtime = Runtime.getRuntime();
    long used = runtime.totalMemory() - runtime.freeMemory();
    return runtime.maxMemory() - used;
  }
}
