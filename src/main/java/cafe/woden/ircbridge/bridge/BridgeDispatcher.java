package cafe.woden.ircbridge.bridge;

import cafe.woden.ircbridge.config.BridgeProperties;
import cafe.woden.ircbridge.config.ChannelMap;
import cafe.woden.ircbridge.discord.DiscordEvent;
import cafe.woden.ircbridge.discord.DiscordGateway;
import cafe.woden.ircbridge.irc.IrcRelayClient;
import cafe.woden.ircbridge.irc.IrcSessionEvent;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Wires both event streams through the translators into the executor, then starts both
 * connections.
 *
 * <p>Events are handled on the thread that delivered them. An exception while handling one event
 * is logged and the stream keeps going.
 */
@ApplicationLayer
@Component
public class BridgeDispatcher implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(BridgeDispatcher.class);

  private final BridgeProperties props;
  private final ChannelMap channels;
  private final IrcRelayClient irc;
  private final DiscordGateway discord;
  private final IrcReadinessGate gate;
  private final IrcEventTranslator ircTranslator;
  private final DiscordEventTranslator discordTranslator;
  private final RelayActionExecutor executor;
  private final CompositeDisposable disposables = new CompositeDisposable();

  public BridgeDispatcher(
      BridgeProperties props,
      ChannelMap channels,
      IrcRelayClient irc,
      DiscordGateway discord,
      IrcReadinessGate gate,
      IrcEventTranslator ircTranslator,
      DiscordEventTranslator discordTranslator,
      RelayActionExecutor executor) {
    this.props = Objects.requireNonNull(props, "props");
    this.channels = Objects.requireNonNull(channels, "channels");
    this.irc = Objects.requireNonNull(irc, "irc");
    this.discord = Objects.requireNonNull(discord, "discord");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.ircTranslator = Objects.requireNonNull(ircTranslator, "ircTranslator");
    this.discordTranslator = Objects.requireNonNull(discordTranslator, "discordTranslator");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public void run(ApplicationArguments args) {
    props.validate();
    if (channels.isEmpty()) {
      log.warn("[ircbridge] bridge.channels is empty; nothing will be relayed");
    }

    disposables.add(irc.events().subscribe(
        this::onIrcEvent,
        err -> log.error("[ircbridge] IRC event stream failed", err)));
    disposables.add(discord.events().subscribe(
        this::onDiscordEvent,
        err -> log.error("[ircbridge] Discord event stream failed", err)));

    log.info("[ircbridge] relaying {} channel(s): {}", channels.size(), channels);
    irc.start();
    discord.start();
  }

  void onIrcEvent(IrcSessionEvent event) {
    try {
      if (event instanceof IrcSessionEvent.Connected) {
        gate.onConnected();
      } else if (event instanceof IrcSessionEvent.Disconnected) {
        gate.onDisconnected();
      } else if (event instanceof IrcSessionEvent.LineReceived received) {
        IrcReadinessGate.Outcome outcome = gate.onLine(received.line(), received.selfNick());
        executor.executeAll(outcome.actions());
        if (outcome.consumed()) return;
        List<RelayAction> actions = ircTranslator.translate(received.line(), received.selfNick());
        executor.executeAll(actions);
      }
    } catch (RuntimeException e) {
      log.warn("[ircbridge] failed to handle IRC event {}", event, e);
    }
  }

  void onDiscordEvent(DiscordEvent event) {
    try {
      executor.executeAll(discordTranslator.translate(event, discord.selfUserId()));
    } catch (RuntimeException e) {
      log.warn("[ircbridge] failed to handle Discord event {}", event, e);
    }
  }

  @PreDestroy
  void shutdown() {
    disposables.dispose();
  }
}
