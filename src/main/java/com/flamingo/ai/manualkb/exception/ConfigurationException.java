package com.flamingo.ai.manualkb.exception;

/** Exception thrown when a rule-set resource is missing or malformed. */
public class ConfigurationException extends RuntimeException {

  private final String resource;

  public ConfigurationException(String resource, String message) {
    super(message);
    this.resource = resource;
  }

  public ConfigurationException(String resource, String message, Throwable cause) {
    super(message, cause);
    this.resource = resource;
  }

  public String getResource() {
    return resource;
  }
}
