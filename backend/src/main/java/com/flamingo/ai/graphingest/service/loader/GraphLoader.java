package com.flamingo.ai.graphingest.service.loader;

import com.flamingo.ai.graphingest.domain.model.EpisodeSource;
import java.time.Instant;

/**
 * Downstream knowledge-graph store that accepts episodes one at a time.
 *
 * <p>Implementations may additionally implement {@link SupportsBulkLoad}. Failures surface as
 * exceptions; rate limits should be signalled with HTTP 429 or a rate-limit error code on a {@link
 * com.flamingo.ai.graphingest.exception.GraphLoaderException} so they are retried.
 */
public interface GraphLoader {

  /**
   * Loads one episode.
   *
   * @param name deterministic episode name
   * @param body episode content
   * @param source kind of body
   * @param description human-readable source description
   * @param referenceTime ingestion time
   */
  void load(
      String name, String body, EpisodeSource source, String description, Instant referenceTime);
}
