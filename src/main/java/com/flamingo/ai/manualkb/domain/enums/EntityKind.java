package com.flamingo.ai.manualkb.domain.enums;

/** Kinds of records handed to the knowledge base repository. */
public enum EntityKind {
  DOCUMENT,
  PRODUCT,
  PART,
  ERROR_CODE,
  VERSION,
  CHUNK,
  IMAGE,
  LINK,
  VIDEO
}
