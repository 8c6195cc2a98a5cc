package com.flamingo.ai.manualkb.domain.enums;

/** Shape of a document version string. */
public enum VersionType {
  EDITION,
  DATE,
  FIRMWARE,
  VERSION,
  REVISION
}
