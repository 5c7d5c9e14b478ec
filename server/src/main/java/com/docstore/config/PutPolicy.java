package com.docstore.config;

/** What a PUT does when its identifier has no row. */
public enum PutPolicy {
  /** Answer 404; identifiers must first be reserved through the LIST key. */
  REJECT_UNKNOWN,
  /** Insert a row under the caller's identifier. */
  CREATE_UNKNOWN
}
