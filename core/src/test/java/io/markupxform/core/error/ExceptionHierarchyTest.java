package io.markupxform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.markupxform.core.error.ExpansionException.Phase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Every concrete exception is an unchecked {@link ExpansionException} with the right phase. */
class ExceptionHierarchyTest {

    @Test
    @DisplayName("Configuration errors → CONFIGURATION phase, no directive")
    void configLoad() {
        ConfigLoadException e = new ConfigLoadException("bad", new IllegalArgumentException());

        assertThat(e).isInstanceOf(RuntimeException.class);
        assertThat(e.phase()).isEqualTo(Phase.CONFIGURATION);
        assertThat(e.directiveLine()).isNull();
        assertThat(e.detail()).isEqualTo("bad");
    }

    @Test
    void depthExceeded() {
        ExpansionDepthExceededException e = new ExpansionDepthExceededException(9, 8, "#!wiki");

        assertThat(e.phase()).isEqualTo(Phase.EXPANSION);
        assertThat(e.depth()).isEqualTo(9);
        assertThat(e.maxDepth()).isEqualTo(8);
        assertThat(e.directiveLine()).isEqualTo("#!wiki");
        assertThat(e.getMessage()).contains("9").contains("8");
    }

    @Test
    void malformedPlaceholder() {
        assertThat(new MalformedPlaceholderException("broken").phase()).isEqualTo(Phase.EXPANSION);
    }

    @Test
    void subParserKeepsCause() {
        IllegalStateException cause = new IllegalStateException("inner");
        SubParserException e = new SubParserException("failed", cause, "rst");

        assertThat(e.phase()).isEqualTo(Phase.EXPANSION);
        assertThat(e.parserId()).isEqualTo("rst");
        assertThat(e).hasCause(cause);
    }
}
