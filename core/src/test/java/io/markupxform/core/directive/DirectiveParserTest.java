package io.markupxform.core.directive;

import static org.assertj.core.api.Assertions.assertThat;

import io.markupxform.core.model.Directive;
import io.markupxform.core.model.RawBlockFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class DirectiveParserTest {

    private final DirectiveParser parser = new DirectiveParser();

    @Test
    @DisplayName("#!highlight python → (highlight, python)")
    void splitsOnFirstSpace() {
        assertThat(parser.parse("#!highlight python")).isEqualTo(new Directive("highlight", "python"));
    }

    @Test
    void keepsEverythingAfterFirstSpaceAsArgs() {
        assertThat(parser.parse("#!wiki red/solid extra")).isEqualTo(new Directive("wiki", "red/solid extra"));
    }

    @Test
    void nameWithoutArgs() {
        Directive directive = parser.parse("#!csv");

        assertThat(directive.formatName()).isEqualTo("csv");
        assertThat(directive.hasArgs()).isFalse();
        assertThat(directive.format()).isEqualTo(RawBlockFormat.CSV);
    }

    @Test
    @DisplayName("Trailing whitespace is trimmed before splitting")
    void rightTrims() {
        assertThat(parser.parse("#!csv   \t")).isEqualTo(new Directive("csv", null));
    }

    @Test
    @DisplayName("Single-char separator argument survives")
    void separatorArgument() {
        assertThat(parser.parse("#!csv ,")).isEqualTo(new Directive("csv", ","));
    }

    @ParameterizedTest
    @ValueSource(strings = {"diff", "cplusplus", "python", "java", "pascal", "irc"})
    @DisplayName("Legacy language directive → highlight with the language as argument")
    void legacyAliases(String language) {
        assertThat(parser.parse("#!" + language)).isEqualTo(new Directive("highlight", language));
    }

    @Test
    void nonLegacyLanguageIsNotRewritten() {
        assertThat(parser.parse("#!ruby").format()).isEqualTo(RawBlockFormat.UNKNOWN);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "#!", "#!   ", "highlight python", "# !csv", " #!csv"})
    @DisplayName("No sentinel or nothing after it → absent directive, not an error")
    void absent(String line) {
        Directive directive = parser.parse(line);

        assertThat(directive).isEqualTo(Directive.ABSENT);
        assertThat(directive.format()).isEqualTo(RawBlockFormat.UNKNOWN);
    }
}
