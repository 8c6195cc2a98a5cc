package com.flamingo.ai.manualkb.service.entity;

import com.flamingo.ai.manualkb.domain.model.ErrorCode;
import com.flamingo.ai.manualkb.exception.UnknownManufacturerException;
import java.util.List;

/**
 * Result of error-code extraction for one page.
 *
 * <p>Callers branch on {@link #kind()} instead of catching an exception when the manufacturer has
 * no rule set; {@link #orElseThrow()} is available where an exception is the better fit.
 *
 * @param kind outcome kind
 * @param manufacturer manufacturer the extraction was requested for, may be null
 * @param codes extracted codes, empty unless {@code kind} is {@link Kind#EXTRACTED}
 */
public record ErrorCodeExtraction(Kind kind, String manufacturer, List<ErrorCode> codes) {

  static final String STAGE = "error code extraction";

  /** Outcome kinds. */
  public enum Kind {
    /** Rules were applied; the code list may still be empty. */
    EXTRACTED,
    /** A manufacturer was named but has no error-code rule set. */
    UNKNOWN_MANUFACTURER,
    /** No manufacturer was given, nothing was attempted. */
    NO_MANUFACTURER
  }

  public ErrorCodeExtraction {
    codes = codes == null ? List.of() : List.copyOf(codes);
  }

  public static ErrorCodeExtraction extracted(String manufacturer, List<ErrorCode> codes) {
    return new ErrorCodeExtraction(Kind.EXTRACTED, manufacturer, codes);
  }

  public static ErrorCodeExtraction unknownManufacturer(String manufacturer) {
    return new ErrorCodeExtraction(Kind.UNKNOWN_MANUFACTURER, manufacturer, List.of());
  }

  public static ErrorCodeExtraction noManufacturer() {
    return new ErrorCodeExtraction(Kind.NO_MANUFACTURER, null, List.of());
  }

  public boolean isUnknownManufacturer() {
    return kind == Kind.UNKNOWN_MANUFACTURER;
  }

  /**
   * Returns the codes, or throws when the manufacturer has no rule set.
   *
   * @return extracted codes, empty when no manufacturer was given
   * @throws UnknownManufacturerException for {@link Kind#UNKNOWN_MANUFACTURER}
   */
  public List<ErrorCode> orElseThrow() {
    if (isUnknownManufacturer()) {
      throw new UnknownManufacturerException(manufacturer, STAGE);
    }
    return codes;
  }
}
