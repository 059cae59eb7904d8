package net.findmytask.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SearchSnippetUtilsTest {

    @Test
    @DisplayName("match in the middle is wrapped in ellipses on both sides")
    void middleMatchHasBothEllipses() {
        String text = "This is a long piece of text that contains the word important in the middle of it.";
        int offset = text.indexOf("important");

        String context = SearchSnippetUtils.extractContext(text, offset, 9, 20);

        assertThat(context)
            .isEqualTo("..." + text.substring(offset - 20, offset + 9 + 20) + "...")
            .contains("important");
    }

    @Test
    @DisplayName("match at the start has no leading ellipsis")
    void startMatchHasNoLeadingEllipsis() {
        String text = "Important information at the start of this text.";

        String context = SearchSnippetUtils.extractContext(text, 0, 9, 20);

        assertThat(context).startsWith("Important").endsWith("...");
    }

    @Test
    @DisplayName("match at the end has no trailing ellipsis")
    void endMatchHasNoTrailingEllipsis() {
        String text = "This text ends with something important";

        String context = SearchSnippetUtils.extractContext(text, 30, 9, 20);

        assertThat(context).startsWith("...").endsWith("important");
    }

    @Test
    @DisplayName("short text is returned whole without ellipses")
    void shortTextUnchanged() {
        assertThat(SearchSnippetUtils.extractContext("Buy milk", 4, 4)).isEqualTo("Buy milk");
    }

    @Test
    @DisplayName("default context is fifty characters each side")
    void defaultContextWidth() {
        String text = "a".repeat(100) + "MATCH" + "b".repeat(100);

        String context = SearchSnippetUtils.extractContext(text, 100, 5);

        assertThat(context).isEqualTo("..." + "a".repeat(50) + "MATCH" + "b".repeat(50) + "...");
    }

    @Test
    @DisplayName("out-of-range positions are clamped and null text yields empty string")
    void clampsOutOfRangeInput() {
        assertThat(SearchSnippetUtils.extractContext(null, 0, 3)).isEmpty();
        assertThat(SearchSnippetUtils.extractContext("abc", 10, 5, 1)).isEqualTo("...c");
        assertThat(SearchSnippetUtils.extractContext("abc", -4, 1, 0)).isEqualTo("a...");
    }

    @Test
    @DisplayName("identical input produces identical output")
    void deterministic() {
        String text = "Document all API endpoints and usage examples";

        assertThat(SearchSnippetUtils.extractContext(text, 13, 3, 5))
            .isEqualTo(SearchSnippetUtils.extractContext(text, 13, 3, 5))
            .isEqualTo("... all API endp...");
    }
}
