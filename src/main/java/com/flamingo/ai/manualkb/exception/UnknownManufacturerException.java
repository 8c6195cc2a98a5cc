package com.flamingo.ai.manualkb.exception;

/**
 * Exception thrown when error-code extraction is requested for a manufacturer without a configured
 * rule set.
 */
public class UnknownManufacturerException extends RuntimeException {

  private final String manufacturer;
  private final String stage;
  private final String userMessage;

  public UnknownManufacturerException(String manufacturer, String stage) {
    super("No " + stage + " patterns configured for manufacturer '" + manufacturer + "'");
    this.manufacturer = manufacturer;
    this.stage = stage;
    this.userMessage =
        "Add a rule set for '" + manufacturer + "' to config/error_code_patterns.json";
  }

  public String getManufacturer() {
    return manufacturer;
  }

  public String getStage() {
    return stage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
