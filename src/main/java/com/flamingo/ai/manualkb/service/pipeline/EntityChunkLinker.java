package com.flamingo.ai.manualkb.service.pipeline;

import com.flamingo.ai.manualkb.domain.model.ErrorCode;
import com.flamingo.ai.manualkb.domain.model.TextChunk;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Attaches error codes to the chunk whose page range covers the code's page. */
@Component
@Slf4j
public class EntityChunkLinker {

  /**
   * Links every unlinked code to the first chunk, by index, that covers its page. Codes without a
   * covering chunk stay unlinked.
   *
   * @param codes error codes
   * @param chunks document chunks
   * @return codes in input order
   */
  public List<ErrorCode> link(List<ErrorCode> codes, List<TextChunk> chunks) {
    List<TextChunk> ordered =
        chunks.stream().sorted(Comparator.comparingInt(TextChunk::chunkIndex)).toList();
    List<ErrorCode> linked =
        codes.stream()
            .map(
                code ->
                    code.isLinked()
                        ? code
                        : covering(ordered, code.pageNumber())
                            .map(chunk -> code.withChunkKey(chunk.naturalKey()))
                            .orElse(code))
            .toList();
    log.debug(
        "Linked {}/{} error codes to chunks",
        linked.stream().filter(ErrorCode::isLinked).count(),
        linked.size());
    return linked;
  }

  private static Optional<TextChunk> covering(List<TextChunk> chunks, int pageNumber) {
    return chunks.stream().filter(chunk -> chunk.coversPage(pageNumber)).findFirst();
  }
}
