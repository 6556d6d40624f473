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
 * Block parser for Creole 1.0 markup.
 *
 * <p>Supported: {@code == heading}, paragraphs, {@code *} and {@code #} lists, {@code ----} rules and
 * {@code {{{ ... }}}} preformatted blocks. A preformatted block whose opening line or first body line
 * is a {@code #!} directive becomes an unexpanded raw block.
 *
 * <p>Inline: {@code **strong**}, {@code //emphasis//}, {@code {{{code}}}}, {@code [[target|label]]}
 * and {@code \\} line breaks.
 */
public final class CreoleParser implements BlockParser {

    public static final String ID = "creole";

    private static final Pattern HEADING = Pattern.compile("^\\s*(={1,6})\\s*(.*?)\\s*=*\\s*$");
    private static final Pattern SEPARATOR = Pattern.compile("^\\s*-{4,}\\s*$");
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*([*#]+)\\s+(.*)$");
    private static final Pattern PRE_START = Pattern.compile("^\\{\\{\\{(.*)$");

    private static final InlineParser INLINE = new InlineParser(List.of(
            InlineParser.Rule.literal("\\{\\{\\{(.+?)\\}\\}\\}", NodeTag.CODE),
            InlineParser.Rule.styled("\\*\\*(.+?)\\*\\*", NodeTag.STRONG),
            InlineParser.Rule.styled("(?<!:)//(.+?)(?<!:)//", NodeTag.EMPHASIS),
            InlineParser.Rule.link("\\[\\[([^|\\]]+)(?:\\|([^\\]]*))?\\]\\]", 2, 1),
            new InlineParser.Rule(Pattern.compile("\\\\\\\\()"), NodeTag.LINE_BREAK, 1, 0, false)));

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

        while (lines.hasNext()) {
            String line = lines.next();
            if (line.isBlank()) {
                blocks.flush();
                continue;
            }
            Matcher m = PRE_START.matcher(line);
            if (m.matches() && !m.group(1).contains("}}}")) {
                blocks.block(preformatted(m.group(1).strip(), lines));
                continue;
            }
            m = HEADING.matcher(line);
            if (m.matches() && !m.group(2).isEmpty()) {
                blocks.heading(m.group(1).length(), m.group(2));
                continue;
            }
            if (SEPARATOR.matcher(line).matches()) {
                blocks.separator();
                continue;
            }
            m = LIST_ITEM.matcher(line);
            if (m.matches() && !isBoldParagraph(m.group(1), line, blocks)) {
                String bullets = m.group(1);
                blocks.listItem(bullets.length(), bullets.charAt(0) == '#', m.group(2));
                continue;
            }
            blocks.paragraphLine(line);
        }
        blocks.flush();
        return body;
    }

    /** Outside a list, {@code **text**} starts a bold paragraph rather than a second-level item. */
    private static boolean isBoldParagraph(String bullets, String line, BlockAssembler blocks) {
        if (!bullets.startsWith("**") || blocks.inList()) {
            return false;
        }
        int open = line.indexOf("**");
        return line.indexOf("**", open + 2) >= 0;
    }

    private static DocumentNode preformatted(String openingRest, LineCursor lines) {
        List<String> body = new ArrayList<>();
        while (lines.hasNext()) {
            String line = lines.next();
            // the closing marker must start the line
            if (line.stripTrailing().equals("}}}")) {
                break;
            }
            // a leading space escapes a literal "}}}" inside the block
            body.add(line.startsWith(" }}}") ? line.substring(1) : line);
        }
        String directive = openingRest;
        if (directive.isEmpty() && !body.isEmpty() && body.get(0).startsWith("#!")) {
            directive = body.remove(0).stripTrailing();
        }
        if (directive.startsWith("#!")) {
            return DocumentNode.placeholder(3, directive, String.join("\n", body));
        }
        if (!directive.isEmpty()) {
            body.add(0, directive);
        }
        return DocumentNode.text(NodeTag.BLOCKCODE, String.join("\n", body));
    }
}
