package cafe.woden.ircbridge.bridge;

import static org.assertj.core.api.Assertions.assertThat;

import cafe.woden.ircbridge.config.ChannelMap;
import cafe.woden.ircbridge.correlation.MessageCorrelationStore;
import cafe.woden.ircbridge.discord.DiscordEvent;
import cafe.woden.ircbridge.format.IrcNickDecorator;
import cafe.woden.ircbridge.format.MarkdownIrcRenderer;
import cafe.woden.ircbridge.format.TimestampRenderer;
import cafe.woden.ircbridge.irc.IrcLine;
import cafe.woden.ircbridge.roster.StaticRosterSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DiscordEventTranslatorTest {

  private static final String SELF = "999";

  private MessageCorrelationStore correlations;
  private DiscordEventTranslator translator;

  @BeforeEach
  void setUp() {
    correlations = new MessageCorrelationStore(0);
    MarkdownIrcRenderer renderer = new MarkdownIrcRenderer(
        new StaticRosterSnapshot("g1").channel("c1", "general"),
        new TimestampRenderer(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC), ZoneOffset.UTC));
    translator = new DiscordEventTranslator(ChannelMap.of(Map.of("c1", "#a")), correlations, renderer);
  }

  private static DiscordEvent.MessageCreated message(
      String id, String authorId, String content, String replyTo, List<String> attachments) {
    return new DiscordEvent.MessageCreated(
        id, "c1", "g1", authorId, "alice", "", null, null, content, replyTo, attachments);
  }

  private static IrcLine line(RelayAction action) {
    return ((RelayAction.SendIrcLine) action).line();
  }

  @Test
  void readyRequestsMembersPerGuild() {
    assertThat(translator.translate(new DiscordEvent.Ready(List.of("g1", "g2")), SELF))
        .containsExactly(
            new RelayAction.RequestGuildMembers("g1"),
            new RelayAction.RequestGuildMembers("g2"));
  }

  @Test
  void messageBecomesTaggedPrivmsg() {
    List<RelayAction> out = translator.translate(
        message("m1", "1", "**hi**\nthere", "", List.of()), SELF);

    assertThat(out).hasSize(1);
    IrcLine line = line(out.get(0));
    assertThat(line.command()).isEqualTo("PRIVMSG");
    assertThat(line.param(0)).isEqualTo("#a");
    assertThat(line.param(1))
        .isEqualTo(IrcNickDecorator.prefix("alice", "alice", null, null) + "\u0002hi\u0002 there");
    assertThat(line.tag("+discord")).isEqualTo("m1");
    assertThat(line.hasTag("+draft/reply")).isFalse();
  }

  @Test
  void attachmentsFollowAsSeparateLines() {
    List<RelayAction> out = translator.translate(
        message("m1", "1", "", "", List.of("https://cdn/a.png", "https://cdn/b.png")), SELF);

    String prefix = IrcNickDecorator.prefix("alice", "alice", null, null);
    assertThat(out).extracting(a -> line(a).param(1))
        .containsExactly(prefix + "https://cdn/a.png", prefix + "https://cdn/b.png");
  }

  @Test
  void replyCarriesEarliestIrcId() {
    correlations.recordPair("irc1", "d0");
    correlations.recordPair("irc2", "d0");

    List<RelayAction> out = translator.translate(message("m2", "1", "yes", "d0", List.of()), SELF);

    assertThat(line(out.get(0)).tag("+draft/reply")).isEqualTo("irc1");
  }

  @Test
  void accentColorTintsTheNickWhenThereIsNoRoleColor() {
    DiscordEvent.MessageCreated accented = new DiscordEvent.MessageCreated(
        "m3", "c1", "g1", "1", "alice", "Ali", null, 0x00FF00, "yo", "", List.of());

    List<RelayAction> out = translator.translate(accented, SELF);

    assertThat(line(out.get(0)).param(1)).isEqualTo("<\u000400FF00A\u200Bli\u000F> yo");
  }

  @Test
  void ownMessagesAndUnmappedChannelsAreDropped() {
    assertThat(translator.translate(message("m1", SELF, "hi", "", List.of()), SELF)).isEmpty();
    DiscordEvent.MessageCreated elsewhere = new DiscordEvent.MessageCreated(
        "m1", "c9", "g1", "1", "alice", "", null, null, "hi", "", List.of());
    assertThat(translator.translate(elsewhere, SELF)).isEmpty();
  }

  @Test
  void deleteRedactsEveryCorrelatedIrcMessage() {
    correlations.recordPair("irc1", "d5");
    correlations.recordPair("irc2", "d5");

    List<RelayAction> out = translator.translate(new DiscordEvent.MessageDeleted("d5", "c1"), SELF);

    assertThat(out).extracting(a -> line(a).toRawLine())
        .containsExactly("REDACT #a irc1", "REDACT #a irc2");
  }

  @Test
  void reactionNeedsCorrelation() {
    DiscordEvent.ReactionAdded reaction = new DiscordEvent.ReactionAdded("d7", "c1", "1", "👍");
    assertThat(translator.translate(reaction, SELF)).isEmpty();

    correlations.recordPair("irc7", "d7");
    List<RelayAction> out = translator.translate(reaction, SELF);

    IrcLine line = line(out.get(0));
    assertThat(line.command()).isEqualTo("TAGMSG");
    assertThat(line.tag("+draft/react")).isEqualTo("👍");
    assertThat(line.tag("+draft/reply")).isEqualTo("irc7");
  }

  @Test
  void typingIsForwardedExceptOwn() {
    List<RelayAction> out = translator.translate(new DiscordEvent.TypingStarted("c1", "1"), SELF);
    assertThat(line(out.get(0)).toRawLine()).isEqualTo("@+typing=active TAGMSG #a");

    assertThat(translator.translate(new DiscordEvent.TypingStarted("c1", SELF), SELF)).isEmpty();
  }

  @Test
  void newlinesAreFlattened() {
    assertThat(DiscordEventTranslator.flattenNewlines("a\r\nb\nc\rd")).isEqualTo("a b c d");
  }
}
