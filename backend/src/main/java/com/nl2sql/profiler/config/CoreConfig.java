package com.nl2sql.profiler.config;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@Configuration
public class CoreConfig {

  public static final String COLUMN_EXECUTOR = "profilerTaskExecutor";
  public static final String RUN_EXECUTOR = "profilingRunExecutor";

  @Bean
  public ObjectMapper objectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  /** Bounded pool for per-column optimizer and analyzer tasks, sized from the CPU count. */
  @Bean(name = COLUMN_EXECUTOR)
  public ThreadPoolTaskExecutor profilerTaskExecutor(ProfilerProperties properties) {
    int cores = Runtime.getRuntime().availableProcessors();
    int poolSize = Math.max(2, cores * properties.getExecutor().getThreadsPerCore());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
    executor.setThreadNamePrefix("profiler-col-");
    executor.setTaskDecorator(mdcPropagatingDecorator());
    // Saturation pushes work back onto the coordinating thread instead of failing the run
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  /** Runs the coordinating routine of asynchronously started profiling runs. */
  @Bean(name = RUN_EXECUTOR)
  public ThreadPoolTaskExecutor profilingRunExecutor(ProfilerProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getExecutor().getRunPoolSize());
    executor.setMaxPoolSize(properties.getExecutor().getRunPoolSize());
    executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
    executor.setThreadNamePrefix("profiler-run-");
    executor.setTaskDecorator(mdcPropagatingDecorator());
    executor.initialize();
    return executor;
  }

  static TaskDecorator mdcPropagatingDecorator() {
    return runnable -> {
      Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    };
  }
}
