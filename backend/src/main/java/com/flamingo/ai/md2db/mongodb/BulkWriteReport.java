package com.flamingo.ai.md2db.mongodb;

import java.util.List;

/**
 * Per-document outcome of one unordered bulk insert.
 *
 * @param inserted number of documents the store accepted
 * @param rejected documents the store refused, by position in the submitted list
 */
public record BulkWriteReport(int inserted, List<Rejection> rejected) {

  public BulkWriteReport {
    rejected = List.copyOf(rejected);
  }

  /**
   * A refused document.
   *
   * @param index position in the submitted list
   * @param duplicate true when refused for an already existing {@code _id}
   * @param reason store error message
   */
  public record Rejection(int index, boolean duplicate, String reason) {}
}
