package io.markupxform.core.markup;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeContent;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.model.TextRun;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-driven parser for inline markup (emphasis, code, links). Each dialect supplies its own rule
 * list; at every position the earliest match wins and ties go to the rule listed first.
 *
 * <p>Immutable and thread-safe.
 */
final class InlineParser {

    /** Attribute holding a link target. */
    static final String HREF = "href";

    /**
     * One inline construct.
     *
     * @param pattern   the pattern to find
     * @param tag       the node to produce
     * @param textGroup group holding the visible text
     * @param hrefGroup group holding the link target, or 0 for none
     * @param recurse   whether the text is itself parsed for inline markup
     */
    record Rule(Pattern pattern, NodeTag tag, int textGroup, int hrefGroup, boolean recurse) {

        static Rule styled(String regex, NodeTag tag) {
            return new Rule(Pattern.compile(regex), tag, 1, 0, true);
        }

        static Rule literal(String regex, NodeTag tag) {
            return new Rule(Pattern.compile(regex), tag, 1, 0, false);
        }

        static Rule link(String regex, int textGroup, int hrefGroup) {
            return new Rule(Pattern.compile(regex), NodeTag.LINK, textGroup, hrefGroup, false);
        }
    }

    private final List<Rule> rules;

    InlineParser(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /** Parses one run of inline text into text runs and inline nodes. */
    List<NodeContent> parse(String text) {
        List<NodeContent> out = new ArrayList<>();
        List<Matcher> matchers = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            matchers.add(rule.pattern().matcher(text));
        }
        int pos = 0;
        StringBuilder pending = new StringBuilder();
        while (pos < text.length()) {
            int best = -1;
            int bestStart = Integer.MAX_VALUE;
            for (int i = 0; i < matchers.size(); i++) {
                Matcher m = matchers.get(i);
                if (m.find(pos) && m.start() < bestStart) {
                    best = i;
                    bestStart = m.start();
                }
            }
            if (best < 0) {
                break;
            }
            Matcher m = matchers.get(best);
            pending.append(text, pos, m.start());
            if (pending.length() > 0) {
                out.add(new TextRun(pending.toString()));
                pending.setLength(0);
            }
            out.add(toNode(rules.get(best), m));
            pos = m.end();
        }
        pending.append(text.substring(Math.min(pos, text.length())));
        if (pending.length() > 0) {
            out.add(new TextRun(pending.toString()));
        }
        return out;
    }

    private DocumentNode toNode(Rule rule, Matcher m) {
        DocumentNode node = new DocumentNode(rule.tag());
        String visible = m.group(rule.textGroup());
        if (rule.hrefGroup() > 0) {
            String href = m.group(rule.hrefGroup());
            node.attribute(HREF, href);
            if (visible == null || visible.isBlank()) {
                visible = href;
            }
        }
        if (visible == null) {
            visible = "";
        }
        if (rule.recurse()) {
            node.appendAll(parse(visible));
        } else if (!visible.isEmpty()) {
            node.appendText(visible);
        }
        return node;
    }
}
