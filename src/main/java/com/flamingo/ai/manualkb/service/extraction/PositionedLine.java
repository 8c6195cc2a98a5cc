package com.flamingo.ai.manualkb.service.extraction;

/**
 * One visual line of a page, rebuilt from positioned glyphs.
 *
 * @param y baseline of the first glyph, in page coordinates from the top
 * @param text glyph text of the line with word separators restored
 */
public record PositionedLine(float y, String text) {}
