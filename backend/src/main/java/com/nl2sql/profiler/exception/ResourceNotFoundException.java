package com.nl2sql.profiler.exception;

/** Requested dataset or profile does not exist. */
public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String message) {
    super(message);
  }
}
