package com.flamingo.ai.graphingest.service.chunking;

/**
 * A window of the outer-trimmed input text.
 *
 * @param index 0-based position in the chunk sequence
 * @param startOffset inclusive character offset into the trimmed input
 * @param endOffset exclusive character offset into the trimmed input
 * @param text exact substring between the two offsets
 */
public record TextChunk(int index, int startOffset, int endOffset, String text) {}
