package com.flamingo.ai.graphingest.service.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphingest.config.IngestionConfig;
import com.flamingo.ai.graphingest.domain.model.Document;
import com.flamingo.ai.graphingest.domain.model.Episode;
import com.flamingo.ai.graphingest.domain.model.EpisodeSource;
import com.flamingo.ai.graphingest.domain.model.Segment;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds episodes with names that are deterministic in document id and segment index. */
@Component
@RequiredArgsConstructor
public class EpisodeFactory {

  private final ObjectMapper objectMapper;
  private final IngestionConfig config;

  public static String segmentEpisodeName(String documentId, int index) {
    return documentId + "_segment_" + index;
  }

  public static String metadataEpisodeName(String documentId) {
    return "document_meta_" + documentId;
  }

  public Episode metadataEpisode(Document document, Instant referenceTime) {
    String text = document.text();
    int previewChars = Math.min(text.length(), config.getLoader().getMetadataPreviewChars());
    String body =
        "DOCUMENT METADATA:\n"
            + "Title: "
            + document.title()
            + "\nSource File: "
            + document.sourceFile()
            + "\nPages: "
            + document.pageCount()
            + "\n\nFull text (first "
            + previewChars
            + " chars):\n"
            + text.substring(0, previewChars)
            + "\n";
    return new Episode(
        metadataEpisodeName(document.id()),
        body,
        EpisodeSource.TEXT,
        "document metadata " + document.sourceFile(),
        referenceTime);
  }

  /** Plain-text episode used by the sequential path. */
  public Episode textEpisode(Document document, Segment segment, Instant referenceTime) {
    return new Episode(
        segmentEpisodeName(document.id(), segment.index()),
        segment.text(),
        EpisodeSource.TEXT,
        description(document, segment),
        referenceTime);
  }

  /** Structured episode used by the bulk path; the body is the segment as JSON. */
  public Episode structuredEpisode(Document document, Segment segment, Instant referenceTime) {
    Map<String, Object> snapshot = segment.toSnapshot();
    String body;
    try {
      body = objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to serialize segment " + segment.index() + " of " + document.id(), e);
    }
    return new Episode(
        segmentEpisodeName(document.id(), segment.index()),
        body,
        EpisodeSource.JSON,
        description(document, segment),
        referenceTime);
  }

  private static String description(Document document, Segment segment) {
    return document.sourceFile() + " chunk " + segment.index();
  }
}
