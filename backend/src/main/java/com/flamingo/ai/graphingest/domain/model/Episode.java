package com.flamingo.ai.graphingest.domain.model;

import java.time.Instant;

/**
 * Wire-level unit submitted to the graph loader. Ephemeral: exists only for the duration of a load
 * call.
 *
 * @param name deterministic name derived from document id and segment index
 * @param body episode content
 * @param source body kind
 * @param description human-readable source description
 * @param referenceTime ingestion time
 */
public record Episode(
    String name, String body, EpisodeSource source, String description, Instant referenceTime) {}
