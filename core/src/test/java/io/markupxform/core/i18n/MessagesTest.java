package io.markupxform.core.i18n;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.Test;

class MessagesTest {

    @Test
    void english() {
        assertThat(Messages.english().invalidArguments("#!bogus"))
                .isEqualTo("Defaulting to plain text due to invalid arguments: \"#!bogus\"");
    }

    @Test
    void german() {
        assertThat(Messages.forLocale(Locale.GERMAN).invalidArguments("#!x"))
                .isEqualTo("Verwende reinen Text wegen ungültiger Argumente: \"#!x\"");
    }

    @Test
    void french() {
        assertThat(Messages.forLocale(Locale.FRANCE).invalidArguments("#!x"))
                .isEqualTo("Affichage en texte brut suite à des arguments invalides : \"#!x\"");
    }

    @Test
    void unknownLocaleFallsBackToEnglish() {
        Messages messages = Messages.forLocale(Locale.JAPANESE);

        assertThat(messages.invalidArguments("#!x")).startsWith("Defaulting to plain text");
        assertThat(messages.locale()).isEqualTo(Locale.JAPANESE);
    }

    @Test
    void bracesInArgumentsAreNotInterpreted() {
        assertThat(Messages.english().invalidArguments("#!csv {0}")).endsWith("\"#!csv {0}\"");
    }
}
