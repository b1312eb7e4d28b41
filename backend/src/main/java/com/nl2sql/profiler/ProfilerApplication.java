package com.nl2sql.profiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProfilerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProfilerApplication.class, args);
  }
}
