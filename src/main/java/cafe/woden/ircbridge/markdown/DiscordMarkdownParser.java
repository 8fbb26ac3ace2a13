package cafe.woden.ircbridge.markdown;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.commonmark.ext.autolink.AutolinkExtension;
import org.commonmark.ext.gfm.strikethrough.Strikethrough;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Block;
import org.commonmark.node.Code;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.Link;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

/**
 * Parses Discord message markdown into a {@link MarkdownDocument}.
 *
 * <p>Inline syntax goes through commonmark-java with Discord's extra delimiters ({@code __},
 * {@code ||}, {@code ~~}) registered and every block type except fenced code switched off.
 * Discord's line-based quotes ({@code > } for one line, {@code >>> } for the rest of the message)
 * are split off before that, since CommonMark quotes swallow continuation lines. Mentions, custom
 * emoji and timestamps are plain text to CommonMark and are picked out of the text nodes
 * afterwards.
 */
public final class DiscordMarkdownParser {

  private static final Pattern ENTITY = Pattern.compile(
      "<(@!?|@&|#)(\\d+)>"
          + "|<a?:(\\w+):\\d+>"
          + "|<t:(-?\\d+)(?::([A-Za-z]))?>"
          + "|@(everyone|here)\\b");

  private static final String DEFAULT_TIMESTAMP_FORMAT = "f";
  private static final String SINGLE_QUOTE = "> ";
  private static final String MULTI_QUOTE = ">>> ";

  private static final Parser PARSER = Parser.builder()
      .enabledBlockTypes(Set.<Class<? extends Block>>of(FencedCodeBlock.class))
      .extensions(List.of(
          StrikethroughExtension.builder().requireTwoTildes(true).build(),
          AutolinkExtension.create()))
      .customDelimiterProcessor(DiscordDelimiterProcessor.underline())
      .customDelimiterProcessor(DiscordDelimiterProcessor.spoiler())
      .includeSourceSpans(IncludeSourceSpans.BLOCKS)
      .build();

  private DiscordMarkdownParser() {}

  public static MarkdownDocument parse(String content) {
    if (content == null || content.isEmpty()) return new MarkdownDocument(List.of());

    TreeBuilder builder = new TreeBuilder();
    List<String> plain = new ArrayList<>();
    String[] lines = content.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      boolean multi = line.startsWith(MULTI_QUOTE);
      if (!multi && !line.startsWith(SINGLE_QUOTE)) {
        plain.add(line);
        continue;
      }
      if (!plain.isEmpty()) {
        builder.plainLines(plain);
        builder.newline();
        plain.clear();
      }
      if (multi) {
        String rest = String.join("\n", List.of(lines).subList(i, lines.length));
        builder.quote(rest.substring(MULTI_QUOTE.length()));
        return builder.document();
      }
      builder.quote(line.substring(SINGLE_QUOTE.length()));
      if (i + 1 < lines.length) builder.newline();
    }
    if (!plain.isEmpty()) builder.plainLines(plain);
    return builder.document();
  }

  /** Maps the CommonMark tree onto {@link MarkdownNode}s, merging adjacent text. */
  private static final class TreeBuilder extends AbstractVisitor {
    private final Deque<List<MarkdownNode>> stack = new ArrayDeque<>();
    private final StringBuilder pendingText = new StringBuilder();

    private TreeBuilder() {
      stack.push(new ArrayList<>());
    }

    MarkdownDocument document() {
      flushText();
      return new MarkdownDocument(stack.peek());
    }

    void newline() {
      pendingText.append('\n');
    }

    void quote(String text) {
      container(MarkdownNode.BlockQuote::new, () -> PARSER.parse(text).accept(this));
    }

    /** Blank lines around the text are kept; CommonMark would drop them. */
    void plainLines(List<String> lines) {
      int from = 0;
      int to = lines.size();
      while (from < to && lines.get(from).isBlank()) from++;
      while (to > from && lines.get(to - 1).isBlank()) to--;
      if (from == to) {
        pendingText.append("\n".repeat(lines.size() - 1));
        return;
      }
      pendingText.append("\n".repeat(from));
      PARSER.parse(String.join("\n", lines.subList(from, to))).accept(this);
      pendingText.append("\n".repeat(lines.size() - to));
    }

    @Override
    public void visit(Document document) {
      Node previous = null;
      for (Node block = document.getFirstChild(); block != null; block = block.getNext()) {
        if (previous != null) pendingText.append("\n".repeat(lineGap(previous, block)));
        block.accept(this);
        previous = block;
      }
    }

    @Override
    public void visit(Paragraph paragraph) {
      visitChildren(paragraph);
    }

    @Override
    public void visit(Text text) {
      pendingText.append(text.getLiteral());
    }

    @Override
    public void visit(SoftLineBreak softLineBreak) {
      newline();
    }

    @Override
    public void visit(HardLineBreak hardLineBreak) {
      newline();
    }

    @Override
    public void visit(HtmlInline htmlInline) {
      pendingText.append(htmlInline.getLiteral());
    }

    @Override
    public void visit(Code code) {
      add(new MarkdownNode.Code("", code.getLiteral()));
    }

    @Override
    public void visit(FencedCodeBlock fencedCodeBlock) {
      String body = stripNewlines(fencedCodeBlock.getLiteral());
      if (body.isEmpty()) return;
      add(new MarkdownNode.Code(language(fencedCodeBlock.getInfo()), body));
    }

    @Override
    public void visit(Emphasis emphasis) {
      container(MarkdownNode.Italic::new, () -> visitChildren(emphasis));
    }

    @Override
    public void visit(StrongEmphasis strongEmphasis) {
      container(MarkdownNode.Bold::new, () -> visitChildren(strongEmphasis));
    }

    @Override
    public void visit(CustomNode customNode) {
      if (customNode instanceof Strikethrough) {
        container(MarkdownNode.Strikethrough::new, () -> visitChildren(customNode));
      } else if (customNode instanceof DiscordDelimiterProcessor.Underline) {
        container(MarkdownNode.Underline::new, () -> visitChildren(customNode));
      } else if (customNode instanceof DiscordDelimiterProcessor.Spoiler) {
        container(MarkdownNode.Spoiler::new, () -> visitChildren(customNode));
      } else {
        visitChildren(customNode);
      }
    }

    @Override
    public void visit(Link link) {
      String label = plainLabel(link);
      if (label != null && isAutolink(label, link.getDestination())) {
        add(new MarkdownNode.Url(label));
        return;
      }
      visitChildren(link);
      pendingText.append(" (");
      add(new MarkdownNode.Url(link.getDestination()));
      pendingText.append(')');
    }

    @Override
    public void visit(Image image) {
      add(new MarkdownNode.Url(image.getDestination()));
    }

    private void container(Function<List<MarkdownNode>, MarkdownNode> factory, Runnable children) {
      flushText();
      stack.push(new ArrayList<>());
      children.run();
      flushText();
      List<MarkdownNode> nodes = stack.pop();
      if (!nodes.isEmpty()) add(factory.apply(nodes));
    }

    private void add(MarkdownNode node) {
      flushText();
      stack.peek().add(node);
    }

    private void flushText() {
      if (pendingText.length() == 0) return;
      String s = pendingText.toString();
      pendingText.setLength(0);
      List<MarkdownNode> target = stack.peek();

      Matcher m = ENTITY.matcher(s);
      int last = 0;
      while (m.find()) {
        if (m.start() > last) target.add(new MarkdownNode.Text(s.substring(last, m.start())));
        target.add(entity(m));
        last = m.end();
      }
      if (last < s.length()) target.add(new MarkdownNode.Text(s.substring(last)));
    }
  }

  private static MarkdownNode entity(Matcher m) {
    if (m.group(1) != null) {
      String kind = m.group(1);
      String id = m.group(2);
      if (kind.equals("#")) return new MarkdownNode.ChannelMention(id);
      if (kind.equals("@&")) return new MarkdownNode.RoleMention(id);
      return new MarkdownNode.UserMention(id);
    }
    if (m.group(3) != null) return new MarkdownNode.Emoji(m.group(3));
    if (m.group(4) != null) {
      String format = m.group(5) == null ? DEFAULT_TIMESTAMP_FORMAT : m.group(5);
      return new MarkdownNode.Timestamp(m.group(4), format);
    }
    return new MarkdownNode.SpecialMention(m.group(6));
  }

  /** Newlines between two sibling blocks, from their source lines. */
  private static int lineGap(Node previous, Node next) {
    List<SourceSpan> before = previous.getSourceSpans();
    List<SourceSpan> after = next.getSourceSpans();
    if (before.isEmpty() || after.isEmpty()) return 1;
    int gap = after.get(0).getLineIndex() - before.get(before.size() - 1).getLineIndex();
    return Math.max(1, gap);
  }

  private static String plainLabel(Link link) {
    Node child = link.getFirstChild();
    if (child instanceof Text text && child.getNext() == null) return text.getLiteral();
    return null;
  }

  /** True for angle-bracket, bare, {@code www.} and mail autolinks, which keep the text as written. */
  private static boolean isAutolink(String label, String destination) {
    return destination.equals(label)
        || destination.equals("http://" + label)
        || destination.equals("mailto:" + label);
  }

  private static String language(String info) {
    if (info == null) return "";
    String trimmed = info.trim();
    int sp = trimmed.indexOf(' ');
    return sp < 0 ? trimmed : trimmed.substring(0, sp);
  }

  private static String stripNewlines(String body) {
    if (body == null) return "";
    int from = 0;
    int to = body.length();
    while (from < to && body.charAt(from) == '\n') from++;
    while (to > from && body.charAt(to - 1) == '\n') to--;
    return body.substring(from, to);
  }
}
