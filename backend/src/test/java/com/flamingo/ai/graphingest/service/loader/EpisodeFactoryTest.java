package com.flamingo.ai.graphingest.service.loader;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.domain.model.Document;
import com.flamingo.ai.graphingest.domain.model.Episode;
import com.flamingo.ai.graphingest.domain.model.EpisodeSource;
import com.flamingo.ai.graphingest.domain.model.Segment;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EpisodeFactoryTest {

  private static final Instant NOW = Instant.parse("2026-02-01T08:00:00Z");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private IngestionConfig config;
  private EpisodeFactory factory;

  @BeforeEach
  void setUp() {
    config = new IngestionConfig();
    factory = new EpisodeFactory(objectMapper, config);
  }

  @Test
  @DisplayName("should name episodes deterministically from document id and index")
  void shouldNameEpisodesDeterministically() {
    assertThat(EpisodeFactory.segmentEpisodeName("circ-9", 12)).isEqualTo("circ-9_segment_12");
    assertThat(EpisodeFactory.metadataEpisodeName("circ-9")).isEqualTo("document_meta_circ-9");
  }

  @Test
  @DisplayName("should include title, source, pages and a bounded text preview in metadata")
  void shouldBuildMetadataEpisode() {
    config.getLoader().setMetadataPreviewChars(10);
    Document document =
        new Document("circ-9", "Travel Rules", "0123456789ABCDEF", "travel.pdf", 4, Map.of());

    Episode episode = factory.metadataEpisode(document, NOW);

    assertThat(episode.name()).isEqualTo("document_meta_circ-9");
    assertThat(episode.source()).isEqualTo(EpisodeSource.TEXT);
    assertThat(episode.referenceTime()).isEqualTo(NOW);
    assertThat(episode.body())
        .contains("Title: Travel Rules")
        .contains("Source File: travel.pdf")
        .contains("Pages: 4")
        .contains("0123456789")
        .doesNotContain("ABCDEF");
  }

  @Test
  @DisplayName("should serialize the segment as the structured episode body")
  void shouldBuildStructuredEpisode() throws Exception {
    Document document = new Document("circ-9", null, "text", "travel.pdf", null, Map.of());
    Segment segment = new Segment(null, "circ-9", 2, "Clause two.", 3, "paragraph", Map.of());

    Episode episode = factory.structuredEpisode(document, segment, NOW);

    assertThat(episode.source()).isEqualTo(EpisodeSource.JSON);
    assertThat(episode.description()).isEqualTo("travel.pdf chunk 2");
    JsonNode body = objectMapper.readTree(episode.body());
    assertThat(body.path("index").asInt()).isEqualTo(2);
    assertThat(body.path("text").asText()).isEqualTo("Clause two.");
    assertThat(body.path("page").asInt()).isEqualTo(3);
    assertThat(body.path("blockType").asText()).isEqualTo("paragraph");
  }
}
