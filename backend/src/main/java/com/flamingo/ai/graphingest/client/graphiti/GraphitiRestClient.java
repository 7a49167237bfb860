package com.flamingo.ai.graphingest.client.graphiti;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.domain.model.Episode;
import com.flamingo.ai.graphingest.domain.model.EpisodeSource;
import com.flamingo.ai.graphingest.exception.GraphLoaderException;
import com.flamingo.ai.graphingest.service.loader.GraphLoader;
import com.flamingo.ai.graphingest.service.loader.SupportsBulkLoad;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for a Graphiti episode ingestion endpoint. Encapsulates all WebClient communication
 * with the graph service and maps error responses to {@link GraphLoaderException}s carrying the
 * status and provider error code, so rate limits can be told apart from fatal rejections.
 */
@Component
@Slf4j
public class GraphitiRestClient implements GraphLoader, SupportsBulkLoad {

  private static final int MAX_ERROR_BODY_CHARS = 500;

  private final WebClient webClient;
  private final Duration readTimeout;
  private final ObjectMapper objectMapper;

  @Autowired
  public GraphitiRestClient(IngestionConfig config, ObjectMapper objectMapper) {
    this(
        WebClient.builder()
            .baseUrl(config.getGraphiti().getBaseUrl())
            .codecs(c -> c.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build(),
        config.getGraphiti().getReadTimeout(),
        objectMapper);
    log.info("Graphiti client initialized: baseUrl={}", config.getGraphiti().getBaseUrl());
  }

  public GraphitiRestClient(WebClient webClient, Duration readTimeout, ObjectMapper objectMapper) {
    this.webClient = webClient;
    this.readTimeout = readTimeout;
    this.objectMapper = objectMapper;
  }

  @Override
  public void load(
      String name, String body, EpisodeSource source, String description, Instant referenceTime) {
    post("/episodes", toRequest(name, body, source, description, referenceTime));
    log.debug("Graphiti accepted episode {}", name);
  }

  @Override
  public void loadBulk(List<Episode> episodes) {
    List<EpisodeRequest> requests =
        episodes.stream()
            .map(
                e ->
                    toRequest(
                        e.name(), e.body(), e.source(), e.description(), e.referenceTime()))
            .toList();
    post("/episodes/bulk", new BulkEpisodeRequest(requests));
    log.debug("Graphiti accepted {} episodes in bulk", episodes.size());
  }

  private void post(String uri, Object request) {
    try {
      webClient
          .post()
          .uri(uri)
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue(request)
          .retrieve()
          .onStatus(
              HttpStatusCode::isError,
              response ->
                  response
                      .bodyToMono(String.class)
                      .defaultIfEmpty("")
                      .map(body -> toException(uri, response.statusCode(), body)))
          .toBodilessEntity()
          .timeout(readTimeout)
          .block();
    } catch (GraphLoaderException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new GraphLoaderException(
          "Graphiti request to " + uri + " failed: " + e.getMessage(), e);
    }
  }

  private GraphLoaderException toException(String uri, HttpStatusCode status, String body) {
    String errorCode = extractErrorCode(body);
    String snippet =
        body.length() > MAX_ERROR_BODY_CHARS ? body.substring(0, MAX_ERROR_BODY_CHARS) : body;
    return new GraphLoaderException(
        status.value(),
        errorCode,
        "Graphiti returned " + status.value() + " for " + uri + ": " + snippet);
  }

  /** Pulls a provider error code from common JSON error shapes; null when absent. */
  String extractErrorCode(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      if (root == null || !root.isObject()) {
        return null;
      }
      JsonNode error = root.path("error");
      for (JsonNode candidate :
          List.of(
              root.path("error_code"),
              root.path("code"),
              error.path("code"),
              error.path("status"),
              error.path("type"))) {
        if (candidate.isTextual() && !candidate.asText().isBlank()) {
          return candidate.asText().toUpperCase(Locale.ROOT);
        }
      }
      return null;
    } catch (IOException e) {
      log.debug("Graphiti error body is not JSON: {}", e.getMessage());
      return null;
    }
  }

  private static EpisodeRequest toRequest(
      String name, String body, EpisodeSource source, String description, Instant referenceTime) {
    return new EpisodeRequest(
        name,
        body,
        source.name().toLowerCase(Locale.ROOT),
        description,
        referenceTime == null ? null : referenceTime.toString());
  }

  record EpisodeRequest(
      String name,
      String episode_body,
      String source,
      String source_description,
      String reference_time) {}

  record BulkEpisodeRequest(List<EpisodeRequest> episodes) {}
}
