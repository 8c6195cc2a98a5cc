package com.flamingo.ai.manualkb.agent;

import com.flamingo.ai.manualkb.agent.dto.ProductSuggestions;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Agent that names the product models a service-manual excerpt is about. */
public interface ProductInferenceAgent {

  @SystemMessage(
      """
        You extract printer and copier product model numbers from service manual text.
        Return only models that the text names explicitly. Do not return part numbers,
        error codes, page numbers, dates or firmware versions. Keep each model exactly as
        printed, including its series name when present (for example "LaserJet Pro M455"
        or "bizhub C450i").

        Return ONLY valid JSON matching this structure:
        {"models": ["...", "..."]}
        """)
  @UserMessage("""
        Manufacturer: {{manufacturer}}

        Text:
        {{text}}
        """)
  ProductSuggestions suggest(@V("manufacturer") String manufacturer, @V("text") String text);
}
