package io.markupxform.core.spi;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ParserArgumentsTest {

    @Test
    void splitsPositionalAndKeyword() {
        ParserArguments args = ParserArguments.parse("  plain class=red mode=x=y ");

        assertThat(args.positional()).containsExactly("plain");
        assertThat(args.keyword()).containsEntry("class", "red").containsEntry("mode", "x=y");
        assertThat(args.raw()).isEqualTo("  plain class=red mode=x=y ");
    }

    @Test
    void nullAndBlankAreEmpty() {
        assertThat(ParserArguments.parse(null)).isSameAs(ParserArguments.empty());
        assertThat(ParserArguments.parse("  ").isEmpty()).isTrue();
    }

    @Test
    void singleKeyword() {
        ParserArguments args = ParserArguments.ofKeyword("class", "a b");

        assertThat(args.keyword("class")).isEqualTo("a b");
        assertThat(args.raw()).isNull();
        assertThat(args.isEmpty()).isFalse();
    }
}
