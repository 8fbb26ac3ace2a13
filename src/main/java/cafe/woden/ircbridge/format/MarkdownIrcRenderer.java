package cafe.woden.ircbridge.format;

import cafe.woden.ircbridge.markdown.DiscordMarkdownParser;
import cafe.woden.ircbridge.markdown.MarkdownDocument;
import cafe.woden.ircbridge.markdown.MarkdownNode;
import cafe.woden.ircbridge.roster.RosterMember;
import cafe.woden.ircbridge.roster.RosterRole;
import cafe.woden.ircbridge.roster.RosterSnapshot;
import java.util.Objects;

/**
 * Renders a Discord markdown tree as IRC control-code text.
 *
 * <p>Emphasis maps to toggle bytes emitted on both enter and exit, so a nested repetition of the
 * same style closes the run early; IRC has no nesting, and that is accepted. Mentions and
 * timestamps are resolved against the roster; misses degrade to fixed placeholders.
 */
public final class MarkdownIrcRenderer {

  static final String INVALID_CHANNEL = "#invalid-channel";
  static final String INVALID_ROLE = "@invalid-role";
  static final String INVALID_USER = "@invalid-user";

  private final RosterSnapshot roster;
  private final TimestampRenderer timestamps;

  public MarkdownIrcRenderer(RosterSnapshot roster, TimestampRenderer timestamps) {
    this.roster = Objects.requireNonNull(roster, "roster");
    this.timestamps = Objects.requireNonNull(timestamps, "timestamps");
  }

  /** Parses raw Discord content and renders it. */
  public String render(String guildId, String content) {
    return render(guildId, DiscordMarkdownParser.parse(content));
  }

  public String render(String guildId, MarkdownDocument document) {
    IrcTextVisitor visitor = new IrcTextVisitor(guildId);
    document.walk(visitor);
    return visitor.out.toString();
  }

  private final class IrcTextVisitor implements MarkdownNode.Visitor {
    private final String guildId;
    private final StringBuilder out = new StringBuilder();

    private IrcTextVisitor(String guildId) {
      this.guildId = Objects.toString(guildId, "");
    }

    @Override
    public void text(MarkdownNode.Text node) {
      out.append(node.content());
    }

    @Override
    public void bold(MarkdownNode.Bold node, boolean entering) {
      out.append(IrcControlCodes.BOLD);
    }

    @Override
    public void italic(MarkdownNode.Italic node, boolean entering) {
      out.append(IrcControlCodes.ITALIC);
    }

    @Override
    public void underline(MarkdownNode.Underline node, boolean entering) {
      out.append(IrcControlCodes.UNDERLINE);
    }

    @Override
    public void strikethrough(MarkdownNode.Strikethrough node, boolean entering) {
      out.append(IrcControlCodes.STRIKETHROUGH);
    }

    @Override
    public void blockQuote(MarkdownNode.BlockQuote node, boolean entering) {
      out.append(entering ? '“' : '”');
    }

    @Override
    public void spoiler(MarkdownNode.Spoiler node, boolean entering) {
      if (entering) {
        out.append(IrcControlCodes.REVERSE).append("||");
      } else {
        out.append("||").append(IrcControlCodes.REVERSE);
      }
    }

    @Override
    public void code(MarkdownNode.Code node) {
      out.append(IrcControlCodes.MONOSPACE).append('`');
      if (!node.language().isEmpty()) {
        out.append(node.language()).append(' ');
      }
      out.append(node.content()).append('`').append(IrcControlCodes.MONOSPACE);
    }

    @Override
    public void url(MarkdownNode.Url node) {
      out.append(node.url());
    }

    @Override
    public void emoji(MarkdownNode.Emoji node) {
      out.append(':').append(node.name()).append(':');
    }

    @Override
    public void channelMention(MarkdownNode.ChannelMention node) {
      out.append(roster.channelName(node.id()).map(name -> "#" + name).orElse(INVALID_CHANNEL));
    }

    @Override
    public void roleMention(MarkdownNode.RoleMention node) {
      out.append(roster.role(guildId, node.id())
          .map(RosterRole::name)
          .map(name -> "@" + name)
          .orElse(INVALID_ROLE));
    }

    @Override
    public void userMention(MarkdownNode.UserMention node) {
      out.append(roster.member(guildId, node.id())
          .map(RosterMember::displayName)
          .map(name -> "@" + name)
          .orElse(INVALID_USER));
    }

    @Override
    public void specialMention(MarkdownNode.SpecialMention node) {
      out.append('@').append(node.text());
    }

    @Override
    public void timestamp(MarkdownNode.Timestamp node) {
      out.append(timestamps.render(node.epoch(), node.formatCode()));
    }
  }
}
