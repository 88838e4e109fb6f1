package dev.runbar.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SearchQueryTest {

  @Test
  void derives_trimmed_and_lowercased_variants() {
    SearchQuery query = SearchQuery.of("  Visual Code \n");

    assertThat(query.raw()).isEqualTo("  Visual Code \n");
    assertThat(query.trimmed()).isEqualTo("Visual Code");
    assertThat(query.lowercased()).isEqualTo("visual code");
    assertThat(query.isEmpty()).isFalse();
  }

  @Test
  void whitespace_only_input_is_empty() {
    assertThat(SearchQuery.of(" \t ").isEmpty()).isTrue();
  }

  @Test
  void null_input_is_treated_as_empty() {
    SearchQuery query = SearchQuery.of(null);

    assertThat(query.raw()).isEmpty();
    assertThat(query.isEmpty()).isTrue();
  }

  @Test
  void lowercasing_is_locale_independent() {
    assertThat(SearchQuery.of("TITLE").lowercased()).isEqualTo("title");
  }

  @Test
  void null_variant_is_rejected() {
    assertThatThrownBy(() -> new SearchQuery("a", null, "a"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
