package io.markupxform.core.engine;

import static io.markupxform.core.testkit.TestTrees.pageWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.markupxform.core.config.ExpanderConfig;
import io.markupxform.core.engine.highlight.DefaultLexerRegistry;
import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.model.RawBlockFormat;
import io.markupxform.core.spi.DocumentParser;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Log entries emitted by {@link RawBlockExpander}: a DEBUG line per block, a WARN line per fallback
 * and one INFO summary per call that expanded anything.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private RawBlockExpander expander;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger expanderLogger;

    @BeforeEach
    void setUp() {
        expander = RawBlockExpander.withDefaults();

        expanderLogger = (Logger) LoggerFactory.getLogger(RawBlockExpander.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        expanderLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        expanderLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<ILoggingEvent> eventsContaining(String key) {
        return logAppender.list.stream()
                .filter(e -> e.getMessage() != null && e.getMessage().contains(key))
                .toList();
    }

    @Test
    @DisplayName("Expanded block → DEBUG rawblock.expand with format and depth")
    void debugPerBlock() {
        expander.expand(pageWith("#!csv", "a;b"));

        List<ILoggingEvent> debug = eventsContaining("rawblock.expand ");
        assertThat(debug).hasSize(1);
        assertThat(debug.get(0).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(debug.get(0).getFormattedMessage()).isEqualTo("rawblock.expand format=csv depth=2");
    }

    @Test
    @DisplayName("Expansion call → one INFO rawblock.expanded summary with the block count")
    void infoSummary() {
        DocumentNode body = DocumentNode.of(
                NodeTag.BODY,
                DocumentNode.placeholder(3, "#!csv", "a"),
                DocumentNode.placeholder(3, "#!highlight python", "x = 1"));

        expander.expand(body);

        List<ILoggingEvent> summary = eventsContaining("rawblock.expanded");
        assertThat(summary).hasSize(1);
        assertThat(summary.get(0).getLevel()).isEqualTo(Level.INFO);
        assertThat(summary.get(0).getFormattedMessage()).startsWith("rawblock.expanded count=2 durationMs=");
    }

    @Test
    @DisplayName("Tree without raw blocks → no INFO summary")
    void noSummaryWhenNothingExpanded() {
        expander.expand(DocumentNode.of(NodeTag.PAGE, DocumentNode.text(NodeTag.PARAGRAPH, "x")));

        assertThat(logAppender.list).isEmpty();
    }

    @Test
    @DisplayName("Fallback → WARN rawblock.invalid-arguments quoting the directive")
    void warnOnFallback() {
        expander.expand(pageWith("#!highlight nosuchlanguage", "x"));

        List<ILoggingEvent> warnings = eventsContaining("rawblock.invalid-arguments");
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getLevel()).isEqualTo(Level.WARN);
        assertThat(warnings.get(0).getFormattedMessage())
                .contains("directive=\"#!highlight nosuchlanguage\"")
                .contains("reason=no lexer for 'nosuchlanguage'");
    }

    @Test
    @DisplayName("Format name is in the MDC while the handler runs and removed afterwards")
    void mdcDuringHandler() {
        List<String> seen = new ArrayList<>();
        DocumentParser parser = mock(DocumentParser.class);
        when(parser.parse(anyString(), anyString())).thenAnswer(invocation -> {
            seen.add(MDC.get(RawBlockExpander.MDC_FORMAT));
            return DocumentNode.of(NodeTag.PAGE, new DocumentNode(NodeTag.BODY));
        });
        SubParserRegistry parsers = new SubParserRegistry();
        parsers.register(RawBlockFormat.MARKDOWN, parser);
        RawBlockExpander custom =
                new RawBlockExpander(ExpanderConfig.DEFAULTS, DefaultLexerRegistry.defaults(), parsers);

        custom.expand(pageWith("#!text/x-markdown", "# hi"));

        assertThat(seen).containsExactly("text/x-markdown");
        assertThat(MDC.get(RawBlockExpander.MDC_FORMAT)).isNull();
    }
}
