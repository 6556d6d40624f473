package io.markupxform.core.markup;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.spi.BlockParser;
import io.markupxform.core.spi.LineCursor;
import io.markupxform.core.spi.ParserArguments;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Block parser for Moin wiki markup.
 *
 * <p>Supported: {@code = heading =} (levels 1-6), paragraphs, indented {@code *} and {@code 1.}
 * lists, {@code ----} rules, {@code ##} comments, and {@code {{{ ... }}}} blocks. A block whose
 * first line carries a {@code #!} directive is emitted as an unexpanded raw block so that the
 * expander handles it; outer blocks may use more braces than the blocks they contain.
 *
 * <p>Inline: {@code '''strong'''}, {@code ''emphasis''}, {@code `code`}, {@code {{{code}}}} and
 * {@code [[target|label]]}.
 */
public final class MoinWikiParser implements BlockParser {

    public static final String ID = "wiki";

    private static final Pattern HEADING = Pattern.compile("^(={1,6})\\s+(.*?)\\s+\\1\\s*$");
    private static final Pattern SEPARATOR = Pattern.compile("^-{4,}\\s*$");
    private static final Pattern LIST_ITEM = Pattern.compile("^(\\s+)(\\*|1\\.)\\s+(.*)$");
    private static final Pattern NOWIKI_START = Pattern.compile("^\\s*(\\{{3,})(.*)$");

    private static final InlineParser INLINE = new InlineParser(List.of(
            InlineParser.Rule.styled("'''(.+?)'''", NodeTag.STRONG),
            InlineParser.Rule.styled("''(.+?)''", NodeTag.EMPHASIS),
            InlineParser.Rule.literal("\\{\\{\\{(.+?)\\}\\}\\}", NodeTag.CODE),
            InlineParser.Rule.literal("`(.+?)`", NodeTag.CODE),
            InlineParser.Rule.link("\\[\\[([^|\\]]+)(?:\\|([^\\]]*))?\\]\\]", 2, 1)));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DocumentNode parseBlock(LineCursor lines, ParserArguments arguments) {
        DocumentNode body = new DocumentNode(NodeTag.BODY);
        String cssClass = arguments.keyword("class");
        if (cssClass != null && !cssClass.isBlank()) {
            body.withClass(cssClass);
        }
        BlockAssembler blocks = new BlockAssembler(body, INLINE);
        List<Integer> indents = new ArrayList<>();

        while (lines.hasNext()) {
            String line = lines.next();
            if (line.isBlank()) {
                blocks.flush();
                indents.clear();
                continue;
            }
            if (line.startsWith("##")) {
                continue;
            }
            Matcher m = NOWIKI_START.matcher(line);
            if (m.matches() && isBlockStart(m.group(1).length(), m.group(2))) {
                blocks.block(nowiki(m.group(1).length(), m.group(2), lines));
                indents.clear();
                continue;
            }
            m = HEADING.matcher(line);
            if (m.matches()) {
                blocks.heading(m.group(1).length(), m.group(2));
                indents.clear();
                continue;
            }
            if (SEPARATOR.matcher(line).matches()) {
                blocks.separator();
                indents.clear();
                continue;
            }
            m = LIST_ITEM.matcher(line);
            if (m.matches()) {
                int level = nestingLevel(indents, m.group(1).length());
                blocks.listItem(level, !"*".equals(m.group(2)), m.group(3));
                continue;
            }
            indents.clear();
            blocks.paragraphLine(line);
        }
        blocks.flush();
        return body;
    }

    /** A line opening braces is a block unless the same line also closes them. */
    private static boolean isBlockStart(int markerLength, String rest) {
        return !rest.stripTrailing().endsWith("}".repeat(markerLength));
    }

    private static DocumentNode nowiki(int markerLength, String rest, LineCursor lines) {
        String closing = "}".repeat(markerLength);
        List<String> body = new ArrayList<>();
        while (lines.hasNext()) {
            String line = lines.next();
            if (line.strip().equals(closing)) {
                break;
            }
            body.add(line);
        }
        String directive = rest.strip();
        if (directive.startsWith("#!")) {
            return DocumentNode.placeholder(markerLength, directive, String.join("\n", body));
        }
        if (!directive.isEmpty()) {
            body.add(0, directive);
        }
        return DocumentNode.text(NodeTag.BLOCKCODE, String.join("\n", body));
    }

    private static int nestingLevel(List<Integer> indents, int indent) {
        while (!indents.isEmpty() && indent < indents.get(indents.size() - 1)) {
            indents.remove(indents.size() - 1);
        }
        if (indents.isEmpty() || indent > indents.get(indents.size() - 1)) {
            indents.add(indent);
        }
        return indents.size();
    }
}
