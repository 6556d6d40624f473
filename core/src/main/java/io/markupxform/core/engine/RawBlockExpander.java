package io.markupxform.core.engine;

import io.markupxform.core.config.ExpanderConfig;
import io.markupxform.core.directive.DirectiveParser;
import io.markupxform.core.engine.highlight.DefaultLexerRegistry;
import io.markupxform.core.error.ExpansionDepthExceededException;
import io.markupxform.core.i18n.Messages;
import io.markupxform.core.model.Directive;
import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeContent;
import io.markupxform.core.model.RawBlock;
import io.markupxform.core.spi.ExpansionListener;
import io.markupxform.core.spi.LexerRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Expands every raw-block placeholder in a document tree, in place.
 *
 * <p>The tree is walked pre-order, parents before children and siblings left to right, using an
 * explicit work stack. Each placeholder found is emptied, its directive is dispatched, the rendered
 * content is appended to it and the node is retagged {@code nowiki-expanded}. The new content is
 * then walked like any other subtree, so raw blocks produced by an embedded parser are expanded in
 * the same call.
 *
 * <p>Format problems never fail the call: they are rendered as an inline diagnostic followed by the
 * body as plain text. Malformed placeholders, exceptions from embedded parsers and raw blocks deeper
 * nested more than {@link ExpanderConfig#maxDepth()} expansions deep do propagate.
 *
 * <p>Thread-safe: all collaborators are immutable after construction. Each call must own its tree.
 */
public final class RawBlockExpander {

    private static final Logger LOG = LoggerFactory.getLogger(RawBlockExpander.class);

    /** The only conversion mode for which {@link #forMode} returns an expander. */
    public static final String EXPAND_ALL = "expandall";

    /** MDC key holding the directive's format name while its handler runs. */
    public static final String MDC_FORMAT = "rawblock.format";

    private final ExpanderConfig config;
    private final DirectiveParser directives = new DirectiveParser();
    private final FormatDispatcher dispatcher;
    private final ExpansionListener listener;

    /**
     * Creates an expander.
     *
     * @param config   expansion settings
     * @param lexers   lexers for highlighted blocks
     * @param parsers  embedded markup parsers
     * @param listener optional listener for expansion events, may be {@code null}
     */
    public RawBlockExpander(
            ExpanderConfig config, LexerRegistry lexers, SubParserRegistry parsers, ExpansionListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(lexers, "lexers must not be null");
        Objects.requireNonNull(parsers, "parsers must not be null");
        DiagnosticBuilder diagnostics = new DiagnosticBuilder(Messages.forLocale(config.locale()));
        this.dispatcher = new FormatDispatcher(
                new HighlightRenderer(lexers, diagnostics, config.fallbackLexer()),
                new CsvTableBuilder(config.csvTableClass()),
                parsers,
                diagnostics,
                config.csvSeparator());
        this.listener = listener; // nullable
    }

    /** Creates an expander without a listener. */
    public RawBlockExpander(ExpanderConfig config, LexerRegistry lexers, SubParserRegistry parsers) {
        this(config, lexers, parsers, null);
    }

    /** An expander with default settings, the built-in lexers and the built-in parsers. */
    public static RawBlockExpander withDefaults() {
        return withDefaults(ExpanderConfig.DEFAULTS);
    }

    /** An expander with the given settings, the built-in lexers and the built-in parsers. */
    public static RawBlockExpander withDefaults(ExpanderConfig config) {
        return new RawBlockExpander(config, DefaultLexerRegistry.defaults(), SubParserRegistry.withDefaults());
    }

    /**
     * Returns an expander for a conversion mode. Only {@value #EXPAND_ALL} expands raw blocks; any
     * other mode, including {@code null}, means the caller wants the tree left as it is.
     */
    public static Optional<RawBlockExpander> forMode(String mode, ExpanderConfig config) {
        if (EXPAND_ALL.equals(mode)) {
            return Optional.of(withDefaults(config));
        }
        return Optional.empty();
    }

    /**
     * Expands all raw blocks under {@code root}, including {@code root} itself.
     *
     * @param root the tree to expand; modified in place
     * @return {@code root}
     * @throws io.markupxform.core.error.MalformedPlaceholderException if a placeholder lacks its
     *     structural children
     * @throws ExpansionDepthExceededException if raw blocks nest deeper than the configured maximum
     * @throws RuntimeException anything an embedded parser throws, unchanged
     */
    public DocumentNode expand(DocumentNode root) {
        Objects.requireNonNull(root, "root must not be null");
        long start = System.nanoTime();
        int expanded = 0;

        Deque<Frame> work = new ArrayDeque<>();
        work.push(new Frame(root, 0, 0));
        while (!work.isEmpty()) {
            Frame frame = work.pop();
            DocumentNode node = frame.node();
            int nesting = frame.nesting();
            if (node.isPlaceholder()) {
                nesting++;
                expandOne(node, frame.depth(), nesting);
                expanded++;
            }
            pushChildren(work, node, frame.depth() + 1, nesting);
        }

        if (expanded > 0) {
            LOG.info("rawblock.expanded count={} durationMs={}", expanded, elapsedMs(start));
        }
        return root;
    }

    /**
     * @param depth   tree depth of the placeholder, the root being 0
     * @param nesting number of placeholders on the path from the root, this one included
     */
    private void expandOne(DocumentNode placeholder, int depth, int nesting) {
        RawBlock block = RawBlock.from(placeholder);
        if (nesting > config.maxDepth()) {
            throw new ExpansionDepthExceededException(nesting, config.maxDepth(), block.directiveLine());
        }
        Directive directive = directives.parse(block.directiveLine());
        String formatName = directive.formatName() == null ? "" : directive.formatName();
        LOG.debug("rawblock.expand format={} depth={}", formatName, depth);

        long start = System.nanoTime();
        DispatchOutcome outcome;
        MDC.put(MDC_FORMAT, formatName);
        try {
            placeholder.removeAll();
            placeholder.markExpanded();
            outcome = dispatcher.dispatch(placeholder, block, directive);
        } finally {
            MDC.remove(MDC_FORMAT);
        }

        if (outcome.isFallback()) {
            LOG.warn(
                    "rawblock.invalid-arguments directive=\"{}\" reason={}",
                    block.directiveLine(),
                    outcome.fallbackReason());
            notifyFallback(block.directiveLine(), outcome.fallbackReason());
        } else {
            notifyExpanded(outcome, formatName, depth, elapsedMs(start));
        }
    }

    /** Pushes element children in reverse so that the leftmost is popped first. */
    private static void pushChildren(Deque<Frame> work, DocumentNode node, int depth, int nesting) {
        List<NodeContent> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i) instanceof DocumentNode child) {
                work.push(new Frame(child, depth, nesting));
            }
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they must not affect expansion.

    private void notifyExpanded(DispatchOutcome outcome, String formatName, int depth, long durationMs) {
        if (listener == null) return;
        try {
            listener.onBlockExpanded(
                    new ExpansionListener.BlockExpandedEvent(outcome.format(), formatName, depth, durationMs));
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onBlockExpanded failed", e);
        }
    }

    private void notifyFallback(String directiveLine, String reason) {
        if (listener == null) return;
        try {
            listener.onBlockFallback(new ExpansionListener.BlockFallbackEvent(directiveLine, reason));
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onBlockFallback failed", e);
        }
    }

    private record Frame(DocumentNode node, int depth, int nesting) {}
}
