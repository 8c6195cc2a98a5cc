package com.flamingo.ai.manualkb.agent.dto;

import java.util.List;

/** Structured output from ProductInferenceAgent. */
public record ProductSuggestions(List<String> models) {}
