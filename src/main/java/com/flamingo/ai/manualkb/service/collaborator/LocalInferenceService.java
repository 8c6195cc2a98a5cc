package com.flamingo.ai.manualkb.service.collaborator;

import java.util.List;

/** Best-effort supplemental extraction through a locally hosted language model. */
public interface LocalInferenceService {

  /**
   * Suggests product model numbers named in free text.
   *
   * @param text page text, already truncated by the caller
   * @param manufacturer canonical manufacturer name
   * @return model numbers as printed, empty when the model finds none
   */
  List<String> suggestProductModels(String text, String manufacturer);
}
