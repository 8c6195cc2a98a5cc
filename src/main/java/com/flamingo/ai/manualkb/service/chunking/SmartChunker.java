package com.flamingo.ai.manualkb.service.chunking;

import com.flamingo.ai.manualkb.config.ManualKbConfig;
import com.flamingo.ai.manualkb.domain.enums.ChunkType;
import com.flamingo.ai.manualkb.domain.model.ContentHash;
import com.flamingo.ai.manualkb.domain.model.TextChunk;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits page texts into overlapping, classified chunks.
 *
 * <p>Paragraphs ({@code \n\n}) are the unit of accumulation. Paragraphs shorter than the configured
 * threshold are merged into the next one; paragraphs larger than the chunk size are split at
 * sentence boundaries, then at word boundaries. When the next unit would push a chunk over the
 * size target the chunk is emitted and the new one starts with the last {@code overlap} characters
 * of the previous one, advanced to the next word boundary. Chunks may span pages.
 *
 * <p>The output depends only on the input; running it twice yields identical fingerprints in the
 * same order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SmartChunker {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern CODE_TOKEN =
      Pattern.compile("\\b\\d{2}\\.[0-9A-Za-z]{2,3}(?:\\.[0-9A-Za-z]{2})?\\b");
  private static final Pattern FULL_CODE_TOKEN =
      Pattern.compile("\\b\\d{2}\\.[0-9A-Za-z]{2,3}\\.[0-9A-Za-z]{2}\\b");
  private static final Pattern NUMBERED_STEP = Pattern.compile("(?m)^\\s*\\d{1,2}[.)]\\s+\\S");
  private static final List<String> ERROR_CUES = List.of("error", "code", "message", "alarm");
  private static final List<String> TROUBLESHOOTING_CUES =
      List.of("troubleshoot", "problem", "symptom", "cause", "remedy", "solution");
  private static final List<String> SPECIFICATION_CUES =
      List.of("specification", "dimension", "weight", "capacity", "voltage", "resolution");
  private static final List<String> INTRODUCTION_CUES =
      List.of("introduction", "overview", "preface", "about this manual", "safety");
  private static final int CUE_DENSITY = 2;
  private static final int STEP_DENSITY = 2;

  private final ManualKbConfig config;

  /**
   * Chunks a document.
   *
   * @param pageTexts 1-based page texts, iterated in page order
   * @param documentId owning document
   * @return chunks indexed contiguously from 0
   */
  public List<TextChunk> chunk(Map<Integer, String> pageTexts, UUID documentId) {
    ManualKbConfig.Chunking settings = config.getChunking();
    int chunkSize = Math.max(1, settings.getSize());
    int overlap = Math.max(0, Math.min(settings.getOverlap(), chunkSize - 1));

    TreeMap<Integer, String> ordered = new TreeMap<>(pageTexts);
    int firstPage = ordered.isEmpty() ? 1 : ordered.firstKey();
    List<Segment> segments = mergeShort(paragraphs(ordered), settings.getShortParagraphLength());

    List<Draft> drafts = new ArrayList<>();
    Draft current = null;
    for (Segment segment : segments) {
      for (Segment piece : splitOversized(segment, chunkSize)) {
        if (current != null
            && !current.isEmpty()
            && current.length() + piece.separator().length() + piece.text().length() > chunkSize) {
          drafts.add(current);
          String tail = overlapTail(current.text(), overlap);
          current = new Draft(tail.isEmpty() ? piece.pageStart() : current.pageEnd);
          if (!tail.isEmpty()) {
            current.append(tail, "", current.pageStart);
            current.append(piece.text(), " ", piece.pageEnd());
            continue;
          }
        }
        if (current == null) {
          current = new Draft(piece.pageStart());
        }
        current.append(piece.text(), current.isEmpty() ? "" : piece.separator(), piece.pageEnd());
      }
    }
    if (current != null && !current.isEmpty()) {
      drafts.add(current);
    }

    List<TextChunk> chunks = new ArrayList<>();
    for (Draft draft : drafts) {
      String text = draft.text().strip();
      if (text.length() < settings.getMinChunkSize()) {
        continue;
      }
      chunks.add(toChunk(text, chunks.size(), documentId, draft, firstPage));
    }
    log.debug("Created {} chunks from {} pages", chunks.size(), ordered.size());
    return chunks;
  }

  /**
   * Drops chunks whose fingerprint already occurred and re-indexes the rest from 0.
   *
   * @param chunks chunks in document order
   * @return unique chunks, contiguous indices
   */
  public List<TextChunk> deduplicate(List<TextChunk> chunks) {
    Set<String> seen = new HashSet<>();
    List<TextChunk> unique = new ArrayList<>();
    for (TextChunk chunk : chunks) {
      if (seen.add(chunk.fingerprint())) {
        unique.add(chunk.withIndex(unique.size()));
      }
    }
    int removed = chunks.size() - unique.size();
    if (removed > 0) {
      log.info("Removed {} duplicate chunks", removed);
    }
    return unique;
  }

  /** First 16 hex chars of SHA-256 over lowercased, whitespace-collapsed text. */
  public static String fingerprint(String text) {
    String normalized = WHITESPACE.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    return ContentHash.sha256Hex(normalized).substring(0, 16);
  }

  static ChunkType classify(String text, boolean onFirstPage) {
    String lower = text.toLowerCase(Locale.ROOT);
    if (FULL_CODE_TOKEN.matcher(text).find()
        || (CODE_TOKEN.matcher(text).find() && ERROR_CUES.stream().anyMatch(lower::contains))) {
      return ChunkType.ERROR_CODE;
    }
    if (cueHits(lower, TROUBLESHOOTING_CUES) >= CUE_DENSITY) {
      return ChunkType.TROUBLESHOOTING;
    }
    if (count(NUMBERED_STEP.matcher(text)) >= STEP_DENSITY) {
      return ChunkType.PROCEDURE;
    }
    if (cueHits(lower, SPECIFICATION_CUES) >= CUE_DENSITY) {
      return ChunkType.SPECIFICATION;
    }
    if (onFirstPage || cueHits(lower, INTRODUCTION_CUES) >= CUE_DENSITY) {
      return ChunkType.INTRODUCTION;
    }
    return ChunkType.TEXT;
  }

  // ---- private helpers ----

  private TextChunk toChunk(String text, int index, UUID documentId, Draft draft, int firstPage) {
    ChunkType type = classify(text, draft.pageStart == firstPage && index == 0);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("char_count", text.length());
    metadata.put("word_count", WHITESPACE.split(text).length);
    metadata.put("has_error_codes", CODE_TOKEN.matcher(text).find());
    metadata.put("chunk_type", type.getValue());
    return TextChunk.builder()
        .chunkIndex(index)
        .documentId(documentId)
        .pageStart(draft.pageStart)
        .pageEnd(draft.pageEnd)
        .text(text)
        .fingerprint(fingerprint(text))
        .chunkType(type)
        .metadata(metadata)
        .build();
  }

  private static List<Segment> paragraphs(Map<Integer, String> pageTexts) {
    List<Segment> segments = new ArrayList<>();
    pageTexts.forEach(
        (page, text) -> {
          if (text == null || text.isBlank()) {
            return;
          }
          for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String stripped = paragraph.strip();
            if (!stripped.isEmpty()) {
              segments.add(new Segment(stripped, page, page, "\n\n"));
            }
          }
        });
    return segments;
  }

  private static List<Segment> mergeShort(List<Segment> segments, int shortLength) {
    List<Segment> merged = new ArrayList<>();
    Segment buffer = null;
    for (Segment segment : segments) {
      if (buffer != null && buffer.text().length() < shortLength) {
        buffer =
            new Segment(
                buffer.text() + "\n\n" + segment.text(),
                buffer.pageStart(),
                segment.pageEnd(),
                buffer.separator());
      } else {
        if (buffer != null) {
          merged.add(buffer);
        }
        buffer = segment;
      }
    }
    if (buffer != null) {
      merged.add(buffer);
    }
    return merged;
  }

  /** Sentence pieces, then word pieces, each at most {@code chunkSize} characters. */
  private static List<Segment> splitOversized(Segment segment, int chunkSize) {
    if (segment.text().length() <= chunkSize) {
      return List.of(segment);
    }
    List<String> pieces = new ArrayList<>();
    for (String sentence : SENTENCE_BREAK.split(segment.text())) {
      if (sentence.length() <= chunkSize) {
        pieces.add(sentence);
      } else {
        pieces.addAll(splitWords(sentence, chunkSize));
      }
    }
    List<Segment> result = new ArrayList<>();
    for (int i = 0; i < pieces.size(); i++) {
      result.add(
          new Segment(
              pieces.get(i), segment.pageStart(), segment.pageEnd(), i == 0 ? "\n\n" : " "));
    }
    return result;
  }

  private static List<String> splitWords(String sentence, int chunkSize) {
    List<String> pieces = new ArrayList<>();
    StringBuilder piece = new StringBuilder();
    for (String word : WHITESPACE.split(sentence.strip())) {
      if (word.length() > chunkSize) {
        if (piece.length() > 0) {
          pieces.add(piece.toString());
          piece.setLength(0);
        }
        for (int i = 0; i < word.length(); i += chunkSize) {
          pieces.add(word.substring(i, Math.min(word.length(), i + chunkSize)));
        }
        continue;
      }
      if (piece.length() > 0 && piece.length() + 1 + word.length() > chunkSize) {
        pieces.add(piece.toString());
        piece.setLength(0);
      }
      if (piece.length() > 0) {
        piece.append(' ');
      }
      piece.append(word);
    }
    if (piece.length() > 0) {
      pieces.add(piece.toString());
    }
    return pieces;
  }

  /**
   * Last {@code overlap} characters of a chunk, starting at a word boundary. A tail that is one
   * unbroken token is kept whole.
   */
  static String overlapTail(String text, int overlap) {
    String trimmed = text.strip();
    if (overlap <= 0 || trimmed.isEmpty()) {
      return "";
    }
    if (trimmed.length() <= overlap) {
      return trimmed;
    }
    int start = trimmed.length() - overlap;
    if (!Character.isWhitespace(trimmed.charAt(start - 1))) {
      int boundary = start;
      while (boundary < trimmed.length() && !Character.isWhitespace(trimmed.charAt(boundary))) {
        boundary++;
      }
      if (boundary < trimmed.length()) {
        start = boundary;
      }
    }
    return trimmed.substring(start).strip();
  }

  private static int cueHits(String lower, List<String> cues) {
    int hits = 0;
    for (String cue : cues) {
      int from = 0;
      while ((from = lower.indexOf(cue, from)) >= 0) {
        hits++;
        from += cue.length();
      }
    }
    return hits;
  }

  private static int count(Matcher matcher) {
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  // ---- inner types ----

  private record Segment(String text, int pageStart, int pageEnd, String separator) {}

  /** Mutable accumulator for one chunk under construction. */
  private static final class Draft {

    private final StringBuilder text = new StringBuilder();
    private final int pageStart;
    private int pageEnd;

    Draft(int pageStart) {
      this.pageStart = pageStart;
      this.pageEnd = pageStart;
    }

    void append(String piece, String separator, int page) {
      text.append(separator).append(piece);
      pageEnd = Math.max(pageEnd, page);
    }

    boolean isEmpty() {
      return text.length() == 0;
    }

    int length() {
      return text.length();
    }

    String text() {
      return text.toString();
    }
  }
}
