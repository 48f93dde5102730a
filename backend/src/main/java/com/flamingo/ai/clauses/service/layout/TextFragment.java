package com.flamingo.ai.clauses.service.layout;

/**
 * One positioned run of text as produced by the layout engine.
 *
 * @param page 1-based page number
 * @param top distance of the fragment's top edge from the top of the page
 * @param left distance of the fragment's left edge from the left of the page
 * @param width horizontal extent of the fragment
 * @param text the fragment text
 * @param fontSize largest glyph size in the fragment, in points
 * @param bold whether the fragment is rendered predominantly in a bold face
 */
public record TextFragment(
    int page, float top, float left, float width, String text, float fontSize, boolean bold) {

  public float right() {
    return left + width;
  }
}
