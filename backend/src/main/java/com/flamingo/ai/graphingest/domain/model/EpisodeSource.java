package com.flamingo.ai.graphingest.domain.model;

/** Kind of body carried by an {@link Episode}. */
public enum EpisodeSource {
  /** Free text, extracted as prose by the graph store. */
  TEXT,

  /** Structured JSON payload. */
  JSON
}
