package com.flamingo.ai.graphingest.domain.model;

/** Path that delivered a document's segments. */
public enum LoadMode {
  /** All segments delivered in one bulk call. */
  BULK,

  /** Segments delivered one by one in index order. */
  SEQUENTIAL,

  /** Only previously failed segments were re-driven. */
  REDRIVE
}
