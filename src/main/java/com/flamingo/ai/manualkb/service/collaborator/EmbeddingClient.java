package com.flamingo.ai.manualkb.service.collaborator;

import java.util.List;

/** Turns chunk texts into embedding vectors. */
public interface EmbeddingClient {

  /**
   * Embeds texts in one batch.
   *
   * @param texts texts to embed
   * @return one vector per text, in input order
   */
  List<float[]> embed(List<String> texts);
}
