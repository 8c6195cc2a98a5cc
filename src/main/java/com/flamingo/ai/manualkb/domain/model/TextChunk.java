package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.ChunkType;
import com.flamingo.ai.manualkb.domain.enums.EntityKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/**
 * A classified slice of document text.
 *
 * @param chunkIndex position within the document, contiguous from 0
 * @param documentId owning document
 * @param pageStart first contributing page
 * @param pageEnd last contributing page, never before {@code pageStart}
 * @param text chunk body
 * @param fingerprint deterministic hash of the normalized text
 * @param chunkType cue-based classification
 * @param metadata char_count, word_count, has_error_codes, chunk_type
 */
@Builder(toBuilder = true)
public record TextChunk(
    int chunkIndex,
    UUID documentId,
    int pageStart,
    int pageEnd,
    String text,
    String fingerprint,
    ChunkType chunkType,
    Map<String, Object> metadata) {

  public TextChunk {
    if (pageStart > pageEnd) {
      throw new IllegalArgumentException(
          "page_start " + pageStart + " is after page_end " + pageEnd);
    }
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Key used to link entities to this chunk and to upsert it. */
  public String naturalKey() {
    return documentId + ":" + fingerprint;
  }

  public boolean coversPage(int pageNumber) {
    return pageStart <= pageNumber && pageNumber <= pageEnd;
  }

  public TextChunk withIndex(int index) {
    return toBuilder().chunkIndex(index).build();
  }

  public PersistedRecord toRecord() {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("chunk_index", chunkIndex);
    attributes.put("page_start", pageStart);
    attributes.put("page_end", pageEnd);
    attributes.put("text_chunk", text);
    attributes.put("fingerprint", fingerprint);
    attributes.put("chunk_type", chunkType.getValue());
    attributes.put("metadata", metadata);
    return new PersistedRecord(EntityKind.CHUNK, naturalKey(), documentId, attributes);
  }
}
