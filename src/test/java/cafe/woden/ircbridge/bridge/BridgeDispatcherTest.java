package cafe.woden.ircbridge.bridge;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.ircbridge.config.BridgeProperties;
import cafe.woden.ircbridge.config.ChannelMap;
import cafe.woden.ircbridge.correlation.MessageCorrelationStore;
import cafe.woden.ircbridge.discord.DiscordEvent;
import cafe.woden.ircbridge.discord.DiscordGateway;
import cafe.woden.ircbridge.format.MarkdownIrcRenderer;
import cafe.woden.ircbridge.format.TimestampRenderer;
import cafe.woden.ircbridge.irc.IrcLine;
import cafe.woden.ircbridge.irc.IrcRelayClient;
import cafe.woden.ircbridge.irc.IrcSessionEvent;
import cafe.woden.ircbridge.roster.StaticRosterSnapshot;
import io.reactivex.rxjava3.core.Flowable;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class BridgeDispatcherTest {

  private IrcRelayClient irc;
  private DiscordGateway discord;
  private RelayActionExecutor executor;
  private BridgeDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    irc = mock(IrcRelayClient.class);
    discord = mock(DiscordGateway.class);
    executor = mock(RelayActionExecutor.class);
    when(irc.events()).thenReturn(Flowable.never());
    when(discord.events()).thenReturn(Flowable.never());
    when(discord.selfUserId()).thenReturn("999");

    ChannelMap channels = ChannelMap.of(Map.of("d1", "#a"));
    MessageCorrelationStore correlations = new MessageCorrelationStore(0);
    MarkdownIrcRenderer renderer = new MarkdownIrcRenderer(
        new StaticRosterSnapshot("g1"), new TimestampRenderer(Clock.systemUTC(), ZoneOffset.UTC));
    dispatcher = new BridgeDispatcher(
        props("token"),
        channels,
        irc,
        discord,
        new IrcReadinessGate(channels),
        new IrcEventTranslator(channels, correlations),
        new DiscordEventTranslator(channels, correlations, renderer),
        executor);
  }

  private static BridgeProperties props(String token) {
    return new BridgeProperties(
        false, 0, null, null, new BridgeProperties.Discord(token),
        new BridgeProperties.Irc("irc.example.org", 0, true, "bridge", null, null, null, 0, null),
        Map.of("d1", "#a"));
  }

  private static IrcSessionEvent line(String raw) {
    return new IrcSessionEvent.LineReceived(IrcLine.parse(raw), "bridge");
  }

  @Test
  void runSubscribesThenStartsBothSides() {
    dispatcher.run(null);

    InOrder order = inOrder(irc, discord);
    order.verify(irc).events();
    order.verify(discord).events();
    order.verify(irc).start();
    order.verify(discord).start();
  }

  @Test
  void invalidConfigurationStopsStartup() {
    BridgeDispatcher broken = new BridgeDispatcher(
        props(""), ChannelMap.of(Map.of()), irc, discord,
        mock(IrcReadinessGate.class), mock(IrcEventTranslator.class),
        mock(DiscordEventTranslator.class), executor);

    assertThatThrownBy(() -> broken.run(null)).isInstanceOf(IllegalArgumentException.class);
    verify(irc, never()).start();
  }

  @Test
  void chatIsHeldBackUntilTheSessionIsReady() {
    dispatcher.onIrcEvent(new IrcSessionEvent.Connected("irc.example.org", 6697));
    dispatcher.onIrcEvent(line(":alice!a@h PRIVMSG #a :early"));

    verify(executor, never()).executeAll(List.of(new RelayAction.SendDiscordMessage(
        "", "d1", "\u0002<alice>\u000F early", "")));

    dispatcher.onIrcEvent(line(":srv PONG srv :ready"));
    dispatcher.onIrcEvent(line(":alice!a@h PRIVMSG #a :now"));

    verify(executor).executeAll(List.of(new RelayAction.SendDiscordMessage(
        "", "d1", "\u0002<alice>\u000F now", "")));
  }

  @Test
  void welcomeJoinsAreExecuted() {
    dispatcher.onIrcEvent(new IrcSessionEvent.Connected("irc.example.org", 6697));
    dispatcher.onIrcEvent(line(":srv 001 bridge :Welcome"));

    verify(executor).executeAll(List.of(new RelayAction.SendIrcLine(IrcLine.of("JOIN", "#a"))));
  }

  @Test
  void discordEventsAreTranslatedWithSelfId() {
    dispatcher.onDiscordEvent(new DiscordEvent.TypingStarted("d1", "999"));
    verify(executor).executeAll(List.of());

    dispatcher.onDiscordEvent(new DiscordEvent.Ready(List.of("g1")));
    verify(executor).executeAll(List.of(new RelayAction.RequestGuildMembers("g1")));
  }

  @Test
  void handlerFailureIsContained() {
    org.mockito.Mockito.doThrow(new IllegalStateException("boom")).when(executor).executeAll(any());

    dispatcher.onDiscordEvent(new DiscordEvent.Ready(List.of("g1")));
    dispatcher.onIrcEvent(line(":srv 001 bridge :Welcome"));
  }
}
