package com.flamingo.ai.graphingest.domain.model;

import java.util.List;

/** A document together with its segments in index order. */
public record MappedDocument(Document document, List<Segment> segments) {

  public MappedDocument {
    segments = List.copyOf(segments);
  }
}
