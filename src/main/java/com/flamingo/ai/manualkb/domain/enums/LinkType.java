package com.flamingo.ai.manualkb.domain.enums;

/** Purpose of a hyperlink found in a document. */
public enum LinkType {
  VIDEO,
  EXTERNAL,
  TUTORIAL,
  SUPPORT,
  DOWNLOAD,
  EMAIL,
  PHONE
}
