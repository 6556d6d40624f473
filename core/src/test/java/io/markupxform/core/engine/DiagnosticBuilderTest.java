package io.markupxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.markupxform.core.i18n.Messages;
import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class DiagnosticBuilderTest {

    @Test
    void divErrorHoldsParagraphWithMessage() {
        DocumentNode diagnostic = new DiagnosticBuilder(Messages.english()).invalidArguments("#!bogus-format");

        assertThat(diagnostic.tag()).isEqualTo(NodeTag.DIV);
        assertThat(diagnostic.cssClass()).isEqualTo("error");
        DocumentNode paragraph = diagnostic.childNodes().get(0);
        assertThat(paragraph.tag()).isEqualTo(NodeTag.PARAGRAPH);
        assertThat(paragraph.textContent())
                .isEqualTo("Defaulting to plain text due to invalid arguments: \"#!bogus-format\"");
    }

    @Test
    void localized() {
        DocumentNode diagnostic =
                new DiagnosticBuilder(Messages.forLocale(Locale.GERMAN)).invalidArguments("#!x");

        assertThat(diagnostic.textContent()).startsWith("Verwende reinen Text").contains("\"#!x\"");
    }
}
