package io.markupxform.core.markup;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.spi.DocumentParser;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Document parser for a practical subset of reStructuredText.
 *
 * <p>Supported: underlined (and over-and-underlined) section titles, with levels assigned in order
 * of first appearance of each adornment character; paragraphs; {@code *}, {@code -}, {@code +}
 * bullet lists and {@code 1.} enumerated lists; literal blocks introduced by {@code ::}; the {@code
 * code-block} / {@code code} / {@code sourcecode} directives (emitted as unexpanded highlight raw
 * blocks); admonition directives such as {@code note} and {@code warning}; and comments.
 *
 * <p>Inline: {@code **strong**}, {@code *emphasis*}, {@code ``literal``} and {@code `label
 * <url>`_}.
 */
public final class RstParser implements DocumentParser {

    public static final String ID = "rst";

    private static final Pattern ADORNMENT = Pattern.compile("^([=\\-~^\"`#*+:.'_])\\1{2,}\\s*$");
    private static final Pattern BULLET = Pattern.compile("^([*+\\-]|\\d+\\.)\\s+(.*)$");
    private static final Pattern DIRECTIVE = Pattern.compile("^\\.\\.\\s+([\\w-]+)::\\s*(.*)$");
    private static final Pattern COMMENT = Pattern.compile("^\\.\\.(\\s.*)?$");

    private static final List<String> CODE_DIRECTIVES = List.of("code-block", "code", "sourcecode");
    private static final List<String> ADMONITIONS =
            List.of("note", "warning", "tip", "caution", "important", "hint", "danger", "attention", "error");

    private static final InlineParser INLINE = new InlineParser(List.of(
            InlineParser.Rule.literal("``(.+?)``", NodeTag.CODE),
            InlineParser.Rule.styled("\\*\\*(.+?)\\*\\*", NodeTag.STRONG),
            InlineParser.Rule.styled("\\*(.+?)\\*", NodeTag.EMPHASIS),
            InlineParser.Rule.link("`([^`<]+?)\\s*<([^>]+)>`__?", 1, 2)));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DocumentNode parse(String text, String contentType) {
        DocumentNode body = new DocumentNode(NodeTag.BODY);
        parseInto(body, LineSplitter.split(text), new ArrayList<>());
        return DocumentNode.of(NodeTag.PAGE, body);
    }

    private void parseInto(DocumentNode container, List<String> lines, List<Character> titleStyles) {
        BlockAssembler blocks = new BlockAssembler(container, INLINE);
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank()) {
                blocks.flush();
                i++;
                continue;
            }

            // over-and-underlined title
            if (ADORNMENT.matcher(line).matches()
                    && i + 2 < lines.size()
                    && !lines.get(i + 1).isBlank()
                    && lines.get(i + 2).strip().equals(line.strip())) {
                blocks.heading(titleLevel(titleStyles, line.charAt(0)), lines.get(i + 1).strip());
                i += 3;
                continue;
            }
            // underlined title
            if (!blocks.inParagraph()
                    && i + 1 < lines.size()
                    && ADORNMENT.matcher(lines.get(i + 1)).matches()
                    && lines.get(i + 1).strip().length() >= line.strip().length()
                    && LineSplitter.leadingWhitespace(line) == 0) {
                blocks.heading(titleLevel(titleStyles, lines.get(i + 1).charAt(0)), line.strip());
                i += 2;
                continue;
            }

            // transition
            if (ADORNMENT.matcher(line).matches() && !blocks.inParagraph()) {
                blocks.separator();
                i++;
                continue;
            }

            Matcher m = DIRECTIVE.matcher(line);
            if (m.matches()) {
                List<String> content = new ArrayList<>();
                i = indentedBlock(lines, i + 1, content);
                directive(blocks, m.group(1), m.group(2).strip(), content, titleStyles);
                continue;
            }
            if (COMMENT.matcher(line).matches()) {
                i = indentedBlock(lines, i + 1, new ArrayList<>());
                continue;
            }

            m = BULLET.matcher(line);
            if (m.matches() && !blocks.inParagraph()) {
                blocks.listItem(1, Character.isDigit(m.group(1).charAt(0)), m.group(2));
                i++;
                continue;
            }

            String stripped = line.stripTrailing();
            if (stripped.endsWith("::")) {
                String intro = stripped.substring(0, stripped.length() - 2).stripTrailing();
                if (!intro.isEmpty()) {
                    blocks.paragraphLine(intro + ":");
                }
                List<String> literal = new ArrayList<>();
                i = indentedBlock(lines, i + 1, literal);
                if (!literal.isEmpty()) {
                    blocks.block(DocumentNode.text(NodeTag.BLOCKCODE, String.join("\n", literal)));
                }
                continue;
            }

            blocks.paragraphLine(line);
            i++;
        }
        blocks.flush();
    }

    private void directive(
            BlockAssembler blocks, String name, String argument, List<String> content, List<Character> titleStyles) {
        if (CODE_DIRECTIVES.contains(name)) {
            String directiveLine = argument.isEmpty() ? "#!highlight text" : "#!highlight " + argument;
            blocks.block(DocumentNode.placeholder(3, directiveLine, String.join("\n", content)));
        } else if (ADMONITIONS.contains(name)) {
            DocumentNode admonition = new DocumentNode(NodeTag.ADMONITION).attribute("type", name);
            List<String> inner = new ArrayList<>();
            if (!argument.isEmpty()) {
                inner.add(argument);
            }
            inner.addAll(content);
            parseInto(admonition, inner, titleStyles);
            blocks.block(admonition);
        } else {
            // unsupported directives keep their content visible
            blocks.block(DocumentNode.text(NodeTag.BLOCKCODE, String.join("\n", content)));
        }
    }

    /**
     * Collects the indented lines following {@code start}, skipping leading blank lines.
     *
     * @return index of the first line after the block
     */
    private static int indentedBlock(List<String> lines, int start, List<String> out) {
        int i = start;
        while (i < lines.size() && lines.get(i).isBlank()) {
            i++;
        }
        List<String> raw = new ArrayList<>();
        while (i < lines.size() && (lines.get(i).isBlank() || LineSplitter.leadingWhitespace(lines.get(i)) > 0)) {
            raw.add(lines.get(i));
            i++;
        }
        while (!raw.isEmpty() && raw.get(raw.size() - 1).isBlank()) {
            raw.remove(raw.size() - 1);
        }
        out.addAll(LineSplitter.dedent(raw));
        return i;
    }

    private static int titleLevel(List<Character> titleStyles, char adornment) {
        int index = titleStyles.indexOf(adornment);
        if (index < 0) {
            titleStyles.add(adornment);
            index = titleStyles.size() - 1;
        }
        return Math.min(index + 1, 6);
    }
}
