package cafe.woden.ircbridge.discord;

import cafe.woden.ircbridge.config.BridgeConfig;
import cafe.woden.ircbridge.config.BridgeProperties;
import cafe.woden.ircbridge.roster.RosterSnapshot;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import jakarta.annotation.PreDestroy;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.requests.restaction.MessageCreateAction;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import net.dv8tion.jda.api.utils.cache.CacheFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * JDA-backed {@link DiscordGateway}.
 *
 * <p>Once logged in, JDA keeps the gateway session alive by itself. Only the initial login is
 * retried here, with the bridge's fixed reconnect delay.
 */
@Service
public class JdaDiscordGateway implements DiscordGateway {

  private static final Logger log = LoggerFactory.getLogger(JdaDiscordGateway.class);

  private final FlowableProcessor<DiscordEvent> bus =
      PublishProcessor.<DiscordEvent>create().toSerialized();

  private final BridgeProperties props;
  private final ScheduledExecutorService loginExec;
  private final AtomicReference<JDA> jdaRef = new AtomicReference<>();
  private final AtomicReference<String> selfUserId = new AtomicReference<>("");
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final RosterSnapshot roster = new JdaRosterSnapshot(jdaRef::get);

  public JdaDiscordGateway(
      BridgeProperties props,
      @Qualifier(BridgeConfig.DISCORD_LOGIN_SCHEDULER) ScheduledExecutorService loginExec) {
    this.props = Objects.requireNonNull(props, "props");
    this.loginExec = Objects.requireNonNull(loginExec, "loginExec");
  }

  @Override
  public Flowable<DiscordEvent> events() {
    return bus.onBackpressureBuffer();
  }

  @Override
  public void start() {
    if (!started.compareAndSet(false, true)) return;
    loginExec.execute(this::login);
  }

  private void login() {
    if (shuttingDown.get()) return;
    JDA jda = null;
    try {
      jda = JDABuilder.createDefault(props.discord().token())
          .enableIntents(
              GatewayIntent.GUILD_MEMBERS,
              GatewayIntent.MESSAGE_CONTENT,
              GatewayIntent.GUILD_MESSAGES,
              GatewayIntent.GUILD_MESSAGE_REACTIONS,
              GatewayIntent.GUILD_MESSAGE_TYPING)
          .setMemberCachePolicy(MemberCachePolicy.ALL)
          .enableCache(CacheFlag.EMOJI)
          .addEventListeners(new JdaRelayListener(bus::onNext))
          .build();
      jdaRef.set(jda);
      jda.awaitReady();
      selfUserId.set(jda.getSelfUser().getId());
      log.info("[ircbridge] logged in to Discord as {}", jda.getSelfUser().getName());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("[ircbridge] Discord login interrupted", e);
    } catch (RuntimeException e) {
      log.warn("[ircbridge] Discord login failed; retrying in {}ms", props.reconnectDelayMs(), e);
      if (jda != null) {
        jdaRef.compareAndSet(jda, null);
        jda.shutdownNow();
      }
      scheduleLogin();
    }
  }

  private void scheduleLogin() {
    if (shuttingDown.get()) return;
    try {
      loginExec.schedule(this::login, props.reconnectDelayMs(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("[ircbridge] Discord login scheduler stopped; not retrying", e);
    }
  }

  @Override
  public Single<String> sendMessage(String channelId, String content, String replyToId) {
    return Single.fromCallable(() -> {
      TextChannel channel = requireChannel(channelId);
      MessageCreateAction action = channel.sendMessage(content);
      String reply = Objects.toString(replyToId, "").trim();
      if (!reply.isEmpty()) {
        action = action.setMessageReference(reply).mentionRepliedUser(false).failOnInvalidReply(false);
      }
      Message sent = action.complete();
      return sent.getId();
    });
  }

  @Override
  public void deleteMessage(String channelId, String messageId) {
    TextChannel channel = channel(channelId);
    if (channel == null) return;
    channel.deleteMessageById(messageId).queue(
        ok -> log.debug("[ircbridge] deleted Discord message {}", messageId),
        err -> log.warn("[ircbridge] could not delete Discord message {}", messageId, err));
  }

  @Override
  public void sendTyping(String channelId) {
    TextChannel channel = channel(channelId);
    if (channel == null) return;
    channel.sendTyping().queue(
        ok -> {},
        err -> log.debug("[ircbridge] typing indicator failed in {}", channelId, err));
  }

  @Override
  public void requestGuildMembers(String guildId) {
    JDA jda = jdaRef.get();
    if (jda == null || !JdaRosterSnapshot.isSnowflake(guildId)) return;
    Guild guild = jda.getGuildById(guildId);
    if (guild == null) return;
    guild.loadMembers()
        .onSuccess(members -> log.info("[ircbridge] loaded {} members of guild {}", members.size(), guild.getName()))
        .onError(err -> log.warn("[ircbridge] could not load members of guild {}", guildId, err));
  }

  @Override
  public String selfUserId() {
    return selfUserId.get();
  }

  @Override
  public RosterSnapshot roster() {
    return roster;
  }

  private TextChannel channel(String channelId) {
    JDA jda = jdaRef.get();
    if (jda == null || !JdaRosterSnapshot.isSnowflake(channelId)) {
      log.debug("[ircbridge] Discord not ready; dropped action for channel {}", channelId);
      return null;
    }
    TextChannel channel = jda.getTextChannelById(channelId);
    if (channel == null) log.warn("[ircbridge] unknown Discord text channel {}", channelId);
    return channel;
  }

  private TextChannel requireChannel(String channelId) {
    TextChannel channel = channel(channelId);
    if (channel == null) {
      throw new IllegalStateException("Discord text channel not available: " + channelId);
    }
    return channel;
  }

  @PreDestroy
  void shutdown() {
    shuttingDown.set(true);
    JDA jda = jdaRef.getAndSet(null);
    if (jda != null) jda.shutdown();
  }
}
