package com.flamingo.ai.md2db.domain.enums;

/** The deduplicated sub-entity collections a question refers to. */
public enum EntityKind {
  OPTION("options"),
  IMAGE("images"),
  FORMULA("formulas");

  private final String collection;

  EntityKind(String collection) {
    this.collection = collection;
  }

  /** Name of the store collection holding this kind. */
  public String getCollection() {
    return collection;
  }
}
