package io.markupxform.core.markup;

import io.markupxform.core.model.DocumentNode;
import io.markupxform.core.model.NodeTag;
import io.markupxform.core.spi.DocumentParser;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Document parser for MediaWiki markup.
 *
 * <p>Supported: {@code == heading ==}, paragraphs, {@code *} and {@code #} lists, {@code ----}
 * rules, {@code <pre>} blocks, space-indented preformatted lines, and {@code <syntaxhighlight
 * lang="...">} / {@code <source lang="...">} blocks, which become unexpanded highlight raw blocks.
 *
 * <p>Inline: {@code '''strong'''}, {@code ''emphasis''}, {@code <code>}, {@code [[Page|label]]}
 * and {@code [url label]}.
 */
public final class MediaWikiParser implements DocumentParser {

    public static final String ID = "mediawiki";

    private static final Pattern HEADING = Pattern.compile("^(={1,6})\\s*(.+?)\\s*\\1\\s*$");
    private static final Pattern SEPARATOR = Pattern.compile("^-{4,}\\s*$");
    private static final Pattern LIST_ITEM = Pattern.compile("^([*#]+)\\s*(.*)$");
    private static final Pattern PRE_START = Pattern.compile("^<pre>(.*)$");
    private static final Pattern SOURCE_START =
            Pattern.compile("^<(syntaxhighlight|source)(?:\\s+[^>]*?lang=\"?([\\w+#.-]+)\"?)?[^>]*>(.*)$");

    private static final InlineParser INLINE = new InlineParser(List.of(
            InlineParser.Rule.styled("'''(.+?)'''", NodeTag.STRONG),
            InlineParser.Rule.styled("''(.+?)''", NodeTag.EMPHASIS),
            InlineParser.Rule.literal("<code>(.+?)</code>", NodeTag.CODE),
            InlineParser.Rule.link("\\[\\[([^|\\]]+)(?:\\|([^\\]]*))?\\]\\]", 2, 1),
            InlineParser.Rule.link("\\[((?:https?|ftp)://[^\\s\\]]+)(?:\\s+([^\\]]*))?\\]", 2, 1)));

    @Override
    public String id() {
        return ID;
    }

    @Override
    public DocumentNode parse(String text, String contentType) {
        DocumentNode body = new DocumentNode(NodeTag.BODY);
        BlockAssembler blocks = new BlockAssembler(body, INLINE);
        List<String> lines = LineSplitter.split(text);

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank()) {
                blocks.flush();
                i++;
                continue;
            }
            Matcher m = SOURCE_START.matcher(line);
            if (m.matches()) {
                String closing = "</" + m.group(1) + ">";
                List<String> content = new ArrayList<>();
                i = collectUntil(lines, i, m.group(3), closing, content);
                String lang = m.group(2) == null ? "text" : m.group(2);
                blocks.block(DocumentNode.placeholder(3, "#!highlight " + lang, String.join("\n", content)));
                continue;
            }
            m = PRE_START.matcher(line);
            if (m.matches()) {
                List<String> content = new ArrayList<>();
                i = collectUntil(lines, i, m.group(1), "</pre>", content);
                blocks.block(DocumentNode.text(NodeTag.BLOCKCODE, String.join("\n", content)));
                continue;
            }
            m = HEADING.matcher(line);
            if (m.matches()) {
                blocks.heading(m.group(1).length(), m.group(2));
                i++;
                continue;
            }
            if (SEPARATOR.matcher(line).matches()) {
                blocks.separator();
                i++;
                continue;
            }
            m = LIST_ITEM.matcher(line);
            if (m.matches()) {
                String bullets = m.group(1);
                blocks.listItem(bullets.length(), bullets.charAt(bullets.length() - 1) == '#', m.group(2));
                i++;
                continue;
            }
            if (line.startsWith(" ")) {
                List<String> content = new ArrayList<>();
                while (i < lines.size() && lines.get(i).startsWith(" ")) {
                    content.add(lines.get(i).substring(1));
                    i++;
                }
                blocks.block(DocumentNode.text(NodeTag.BLOCKCODE, String.join("\n", content)));
                continue;
            }
            blocks.paragraphLine(line);
            i++;
        }
        blocks.flush();
        return DocumentNode.of(NodeTag.PAGE, body);
    }

    /**
     * Collects block content starting with the remainder of the opening line, up to the closing tag.
     *
     * @return index of the first line after the block
     */
    private static int collectUntil(List<String> lines, int openLine, String rest, String closing, List<String> out) {
        int close = rest.indexOf(closing);
        if (close >= 0) {
            out.add(rest.substring(0, close));
            return openLine + 1;
        }
        if (!rest.isEmpty()) {
            out.add(rest);
        }
        int i = openLine + 1;
        while (i < lines.size()) {
            String line = lines.get(i++);
            close = line.indexOf(closing);
            if (close >= 0) {
                if (close > 0) {
                    out.add(line.substring(0, close));
                }
                break;
            }
            out.add(line);
        }
        return i;
    }
}
