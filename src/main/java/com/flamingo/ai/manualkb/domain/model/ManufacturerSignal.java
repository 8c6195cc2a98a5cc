package com.flamingo.ai.manualkb.domain.model;

import com.flamingo.ai.manualkb.domain.enums.SignalSource;

/**
 * One weighted piece of evidence for a manufacturer.
 *
 * @param manufacturer canonical manufacturer name
 * @param source where the evidence was found
 * @param weight contribution to the manufacturer's score
 */
public record ManufacturerSignal(String manufacturer, SignalSource source, double weight) {}
