package com.taggernews.ingest.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TagSimilarityTest {

  @Test
  void identicalNamesIgnoringCaseAreFullySimilar() {
    assertEquals(1.0, TagSimilarity.ratio("Kubernetes", " kubernetes "));
  }

  @Test
  void singleTypoStaysAboveMergeThreshold() {
    assertThat(TagSimilarity.ratio("Kubernetes", "Kubernets")).isGreaterThan(0.85);
  }

  @Test
  void unrelatedNamesAreFarApart() {
    assertThat(TagSimilarity.ratio("Rust", "Finance")).isLessThan(0.5);
  }

  @Test
  void levenshteinCountsEdits() {
    assertEquals(3, TagSimilarity.levenshtein("kitten", "sitting"));
    assertEquals(4, TagSimilarity.levenshtein("", "rust"));
  }
}
