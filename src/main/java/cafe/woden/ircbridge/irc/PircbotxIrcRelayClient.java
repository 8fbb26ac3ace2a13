package cafe.woden.ircbridge.irc;

import cafe.woden.ircbridge.config.BridgeConfig;
import cafe.woden.ircbridge.config.BridgeProperties;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import jakarta.annotation.PreDestroy;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.pircbotx.PircBotX;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * PircBotX-backed {@link IrcRelayClient}.
 *
 * <p>One session at a time runs on the dedicated IRC scheduler thread: {@code startBot()} blocks
 * for the lifetime of the connection, and when it returns (or fails) the next attempt is
 * scheduled after {@code bridge.reconnect-delay-ms}. Attempts continue until shutdown.
 */
@Service
public class PircbotxIrcRelayClient implements IrcRelayClient {

  private static final Logger log = LoggerFactory.getLogger(PircbotxIrcRelayClient.class);

  /** Raw protocol traffic; enabled with {@code bridge.debug=true}. */
  public static final String WIRE_LOGGER = "cafe.woden.ircbridge.irc.wire";
  private static final Logger wire = LoggerFactory.getLogger(WIRE_LOGGER);

  private static final String REDACT = "REDACT";

  private final FlowableProcessor<IrcSessionEvent> bus =
      PublishProcessor.<IrcSessionEvent>create().toSerialized();

  private final BridgeProperties props;
  private final PircbotxBotFactory botFactory;
  private final PircbotxInputParserHookInstaller hookInstaller;
  private final ScheduledExecutorService exec;
  private final PircbotxSessionState state = new PircbotxSessionState();
  private final Object writeLock = new Object();

  public PircbotxIrcRelayClient(
      BridgeProperties props,
      PircbotxBotFactory botFactory,
      PircbotxInputParserHookInstaller hookInstaller,
      @Qualifier(BridgeConfig.IRC_CONNECTION_SCHEDULER) ScheduledExecutorService exec) {
    this.props = Objects.requireNonNull(props, "props");
    this.botFactory = Objects.requireNonNull(botFactory, "botFactory");
    this.hookInstaller = Objects.requireNonNull(hookInstaller, "hookInstaller");
    this.exec = Objects.requireNonNull(exec, "exec");
  }

  @Override
  public Flowable<IrcSessionEvent> events() {
    return bus.onBackpressureBuffer();
  }

  @Override
  public void start() {
    if (!state.started.compareAndSet(false, true)) return;
    exec.execute(this::runSession);
  }

  @Override
  public void write(IrcLine line) {
    if (line == null) return;
    synchronized (writeLock) {
      PircBotX bot = state.liveBot.get();
      if (bot == null) {
        log.debug("[ircbridge] not connected; dropped {}", line.command());
        return;
      }
      if (REDACT.equals(line.command())
          && !state.isCapEnabled(PircbotxBotFactory.CAP_MESSAGE_REDACTION)) {
        log.debug("[ircbridge] {} not negotiated; dropped REDACT", PircbotxBotFactory.CAP_MESSAGE_REDACTION);
        return;
      }
      String raw = line.toRawLine();
      if (props.debug()) wire.debug(">>> {}", raw);
      bot.sendRaw().rawLine(raw);
    }
  }

  private void runSession() {
    if (state.shuttingDown.get()) return;
    BridgeProperties.Irc irc = props.irc();
    PircBotX bot;
    try {
      bot = botFactory.build(irc);
    } catch (RuntimeException e) {
      log.warn("[ircbridge] could not configure IRC connection to {}:{}", irc.host(), irc.port(), e);
      scheduleReconnect();
      return;
    }

    state.beginSession(bot);
    hookInstaller.install(bot, state, bus::onNext, props.debug());

    log.info("[ircbridge] connecting to {}:{} as {}", irc.host(), irc.port(), irc.nick());
    bus.onNext(new IrcSessionEvent.Connected(irc.host(), irc.port()));

    String reason = "Connection closed";
    try {
      bot.startBot();
    } catch (Exception e) {
      reason = Objects.toString(e.getMessage(), e.getClass().getSimpleName());
      log.warn("[ircbridge] IRC connection to {}:{} failed", irc.host(), irc.port(), e);
    } finally {
      synchronized (writeLock) {
        state.endSession(bot);
      }
    }

    bus.onNext(new IrcSessionEvent.Disconnected(reason));
    if (!state.shuttingDown.get()) {
      log.warn("[ircbridge] IRC disconnected ({}); reconnecting in {}ms", reason, props.reconnectDelayMs());
    }
    scheduleReconnect();
  }

  private void scheduleReconnect() {
    if (state.shuttingDown.get()) return;
    try {
      exec.schedule(this::runSession, props.reconnectDelayMs(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("[ircbridge] IRC scheduler stopped; not reconnecting", e);
    }
  }

  @PreDestroy
  void shutdown() {
    state.shuttingDown.set(true);
    PircBotX bot = state.botRef.get();
    if (bot == null) return;
    try {
      bot.stopBotReconnect();
      bot.sendIRC().quitServer("Bridge shutting down");
    } catch (RuntimeException e) {
      log.debug("[ircbridge] QUIT during shutdown failed", e);
    }
    try {
      bot.close();
    } catch (RuntimeException e) {
      log.debug("[ircbridge] closing IRC connection during shutdown failed", e);
    }
  }
}
