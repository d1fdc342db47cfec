package com.flamingo.ai.roadmap.service.generation.parse;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class JsonFragmentExtractorTest {

  @Test
  void shouldStripCodeFences() {
    assertThat(JsonFragmentExtractor.stripCodeFences("```json\n{\"a\":1}\n```"))
        .isEqualTo("{\"a\":1}");
  }

  @Test
  void shouldFindFragmentsEmbeddedInProse() {
    List<String> fragments =
        JsonFragmentExtractor.fragmentsInOrder("Here you go: {\"a\":[1,2]} and [3] done.");

    assertThat(fragments).containsExactly("{\"a\":[1,2]}", "[3]");
  }

  @Test
  void shouldIgnoreBracketsInsideStrings() {
    String text = "{\"title\":\"Use {curly} and [square] \\\"quoted\\\" text\"}";

    assertThat(JsonFragmentExtractor.fragmentsInOrder(text)).containsExactly(text);
  }

  @Test
  void shouldOrderBySize_largestFirst() {
    List<String> fragments = JsonFragmentExtractor.fragmentsBySize("[1] {\"longer\":true}");

    assertThat(fragments).containsExactly("{\"longer\":true}", "[1]");
  }

  @Test
  void shouldScanInsideUnbalancedOpener() {
    String truncated = "{\"weeks\":[{\"week_number\":1},{\"week_number\":2";

    List<String> fragments = JsonFragmentExtractor.fragmentsInOrder(truncated);

    assertThat(fragments).containsExactly("{\"week_number\":1}");
  }

  @Test
  void shouldReportMismatchedBrackets() {
    assertThat(JsonFragmentExtractor.findMatchingEnd("{\"a\":1]", 0)).isEqualTo(-1);
    assertThat(JsonFragmentExtractor.findMatchingEnd("[1,{}]x", 0)).isEqualTo(5);
  }
}
