package com.flamingo.ai.roadmap.service.generation.parse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Locates balanced JSON objects and arrays embedded in free text (model preambles, Markdown code
 * fences, trailing remarks).
 *
 * <p>Scanning is string-aware: braces inside quoted values do not count. When an opening bracket is
 * never closed (typically a response cut off at the completion-token limit) the scan continues
 * inside it, so complete inner objects are still found.
 */
final class JsonFragmentExtractor {

  private static final Pattern CODE_FENCE = Pattern.compile("```[a-zA-Z]*");

  private JsonFragmentExtractor() {}

  /** Removes Markdown code fence markers, keeping their content. */
  static String stripCodeFences(String text) {
    return CODE_FENCE.matcher(text).replaceAll("").trim();
  }

  /**
   * Returns every outermost balanced fragment, largest first.
   *
   * @param text raw model output
   * @return fragments ordered by descending length; empty if none
   */
  static List<String> fragmentsBySize(String text) {
    List<String> fragments = fragmentsInOrder(text);
    fragments.sort(Comparator.comparingInt(String::length).reversed());
    return fragments;
  }

  /** Returns every outermost balanced fragment in order of appearance. */
  static List<String> fragmentsInOrder(String text) {
    List<String> fragments = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return fragments;
    }
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '{' || c == '[') {
        int end = findMatchingEnd(text, i);
        if (end > i) {
          fragments.add(text.substring(i, end + 1));
          i = end + 1;
          continue;
        }
      }
      i++;
    }
    return fragments;
  }

  /**
   * Finds the index of the bracket closing the one at {@code start}.
   *
   * @return closing index, or -1 when the fragment is unbalanced
   */
  static int findMatchingEnd(String text, int start) {
    char open = text.charAt(start);
    char close = open == '{' ? '}' : ']';
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;

    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{' || c == '[') {
        depth++;
      } else if (c == '}' || c == ']') {
        depth--;
        if (depth == 0) {
          return c == close ? i : -1;
        }
        if (depth < 0) {
          return -1;
        }
      }
    }
    return -1;
  }
}
