package cafe.woden.ircbridge.markdown;

import java.util.List;
import java.util.Objects;

/**
 * One node of a parsed Discord message.
 *
 * <p>The variant set is closed. Consumers implement {@link Visitor}, which has one callback per
 * variant, so adding a variant is a compile error everywhere the tree is walked. Containers are
 * visited twice (entering, then exiting after their children); leaves are visited once with
 * {@code entering == true}.
 */
public sealed interface MarkdownNode permits
    MarkdownNode.Container,
    MarkdownNode.Text,
    MarkdownNode.Code,
    MarkdownNode.Url,
    MarkdownNode.Emoji,
    MarkdownNode.ChannelMention,
    MarkdownNode.RoleMention,
    MarkdownNode.UserMention,
    MarkdownNode.SpecialMention,
    MarkdownNode.Timestamp {

  void accept(Visitor visitor, boolean entering);

  /** A node whose children are walked between its enter and exit visits. */
  sealed interface Container extends MarkdownNode permits
      Bold, Italic, Underline, Strikethrough, BlockQuote, Spoiler {
    List<MarkdownNode> children();
  }

  interface Visitor {
    void text(Text node);

    void bold(Bold node, boolean entering);

    void italic(Italic node, boolean entering);

    void underline(Underline node, boolean entering);

    void strikethrough(Strikethrough node, boolean entering);

    void blockQuote(BlockQuote node, boolean entering);

    void spoiler(Spoiler node, boolean entering);

    void code(Code node);

    void url(Url node);

    void emoji(Emoji node);

    void channelMention(ChannelMention node);

    void roleMention(RoleMention node);

    void userMention(UserMention node);

    void specialMention(SpecialMention node);

    void timestamp(Timestamp node);
  }

  record Text(String content) implements MarkdownNode {
    public Text {
      content = Objects.toString(content, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.text(this);
    }
  }

  record Bold(List<MarkdownNode> children) implements Container {
    public Bold {
      children = List.copyOf(children);
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.bold(this, entering);
    }
  }

  record Italic(List<MarkdownNode> children) implements Container {
    public Italic {
      children = List.copyOf(children);
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.italic(this, entering);
    }
  }

  record Underline(List<MarkdownNode> children) implements Container {
    public Underline {
      children = List.copyOf(children);
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.underline(this, entering);
    }
  }

  record Strikethrough(List<MarkdownNode> children) implements Container {
    public Strikethrough {
      children = List.copyOf(children);
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.strikethrough(this, entering);
    }
  }

  record BlockQuote(List<MarkdownNode> children) implements Container {
    public BlockQuote {
      children = List.copyOf(children);
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.blockQuote(this, entering);
    }
  }

  record Spoiler(List<MarkdownNode> children) implements Container {
    public Spoiler {
      children = List.copyOf(children);
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.spoiler(this, entering);
    }
  }

  /** Inline or fenced code. {@code language} is empty when none was given. */
  record Code(String language, String content) implements MarkdownNode {
    public Code {
      language = Objects.toString(language, "");
      content = Objects.toString(content, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.code(this);
    }
  }

  record Url(String url) implements MarkdownNode {
    public Url {
      url = Objects.toString(url, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.url(this);
    }
  }

  /** A custom emoji reference; {@code name} carries no colons. */
  record Emoji(String name) implements MarkdownNode {
    public Emoji {
      name = Objects.toString(name, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.emoji(this);
    }
  }

  record ChannelMention(String id) implements MarkdownNode {
    public ChannelMention {
      id = Objects.toString(id, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.channelMention(this);
    }
  }

  record RoleMention(String id) implements MarkdownNode {
    public RoleMention {
      id = Objects.toString(id, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.roleMention(this);
    }
  }

  record UserMention(String id) implements MarkdownNode {
    public UserMention {
      id = Objects.toString(id, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.userMention(this);
    }
  }

  /** {@code @everyone} / {@code @here}; {@code text} is the word after the {@code @}. */
  record SpecialMention(String text) implements MarkdownNode {
    public SpecialMention {
      text = Objects.toString(text, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.specialMention(this);
    }
  }

  /**
   * {@code <t:epoch:format>}. {@code epoch} is kept as text so that a malformed value can still be
   * represented and rendered as a placeholder.
   */
  record Timestamp(String epoch, String formatCode) implements MarkdownNode {
    public Timestamp {
      epoch = Objects.toString(epoch, "");
      formatCode = Objects.toString(formatCode, "");
    }

    @Override
    public void accept(Visitor visitor, boolean entering) {
      visitor.timestamp(this);
    }
  }
}
