package com.flamingo.ai.manualkb.exception;

import com.flamingo.ai.manualkb.domain.enums.EntityKind;

/** Exception thrown when a knowledge base write fails. */
public class PersistenceFailureException extends RuntimeException {

  private final EntityKind kind;
  private final String naturalKey;

  public PersistenceFailureException(EntityKind kind, String naturalKey, String message) {
    super(message);
    this.kind = kind;
    this.naturalKey = naturalKey;
  }

  public PersistenceFailureException(
      EntityKind kind, String naturalKey, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.naturalKey = naturalKey;
  }

  public EntityKind getKind() {
    return kind;
  }

  public String getNaturalKey() {
    return naturalKey;
  }
}
