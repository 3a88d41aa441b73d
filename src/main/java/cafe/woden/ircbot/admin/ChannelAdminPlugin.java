package cafe.woden.ircbot.admin;

import cafe.woden.ircbot.config.PluginConfig;
import cafe.woden.ircbot.irc.Hostmasks;
import cafe.woden.ircbot.irc.InvalidParameterException;
import cafe.woden.ircbot.irc.IrcEvents;
import cafe.woden.ircbot.irc.IrcRequests;
import cafe.woden.ircbot.irc.ModeChange;
import cafe.woden.ircbot.irc.NoSuchNickException;
import cafe.woden.ircbot.irc.OperationFailedException;
import cafe.woden.ircbot.irc.WhoisReply;
import cafe.woden.ircbot.irc.WhoisTimeoutException;
import cafe.woden.ircbot.plugin.AbstractBotPlugin;
import cafe.woden.ircbot.plugin.CommandContext;
import cafe.woden.ircbot.plugin.PluginRegistry;
import cafe.woden.ircbot.transport.BotEvent;
import cafe.woden.ircbot.transport.BotRequest;
import cafe.woden.ircbot.transport.Transport;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.exceptions.CompositeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel operator commands with optional durations.
 *
 * <p>Timed actions (a quiet for ten minutes, an unban in an hour) are handed to a
 * {@link ScheduledActionEngine} stored in this plugin's config, so they survive restarts. When the
 * reversal is observed on the channel before the timer fires, the timer is dropped.
 *
 * <p>The command methods are bound to chat commands by the command layer. Each returns a
 * {@link Completable} that completes once the user has been answered; only unexpected failures are
 * signalled as errors.
 */
public class ChannelAdminPlugin extends AbstractBotPlugin {
  private static final Logger log = LoggerFactory.getLogger(ChannelAdminPlugin.class);

  public static final String NAME = "admin.ChannelAdmin";
  public static final String TIMED_QUIET = "admin.timedQuiet";
  public static final String DEFAULT_TIME = "defaulttime";

  static final String DEFAULT_REDIRECT = "##FIX_YOUR_CONNECTION";
  static final long REDIRECT_SECONDS = 2 * 60 * 60;

  private final Scheduler scheduler;
  private final ScheduledActionEngine engine;
  private final HostmaskResolver resolver;

  public ChannelAdminPlugin(
      String name, Transport transport, PluginRegistry registry, Scheduler scheduler) {
    super(name, transport, registry);
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.engine = new ScheduledActionEngine(transport, this::config, scheduler);
    this.resolver = new HostmaskResolver(transport);
  }

  @Override
  public List<String> requires() {
    return List.of("irc.OpProvider");
  }

  @Override
  protected void onReload(PluginConfig config) {
    config.putIfAbsent(ScheduledActionEngine.LATERS, new ArrayList<>());
    config.putIfAbsent(DEFAULT_TIME, null);
    if (isStarted()) {
      engine.resync();
    }
  }

  @Override
  protected void onStart() {
    engine.resync();
    onEvent(IrcEvents.MODE_CHANGED, this::onModeChanged);
    onRequest(TIMED_QUIET, this::onTimedQuiet);
  }

  @Override
  protected void onStop() {
    engine.stop();
  }

  /** The engine owned by this plugin instance. */
  public ScheduledActionEngine engine() {
    return engine;
  }

  private void onModeChanged(BotEvent event) {
    ModeChange change;
    try {
      change = ModeChange.fromEvent(event);
    } catch (IllegalArgumentException e) {
      log.debug("[ircbot] Ignoring malformed mode change {}: {}", event, e.getMessage());
      return;
    }
    engine.invalidate(change.arg(), change.channel(), change.modeSpec());
  }

  /**
   * {@code admin.timedQuiet(channel, target, duration)}: quiets a nick or mask, lifting it after
   * {@code duration} (seconds, or a time string).
   */
  private Maybe<Object> onTimedQuiet(BotRequest request) {
    String channel = Objects.requireNonNull(request.string("channel"), "channel");
    String target = Objects.requireNonNull(request.string("target"), "target");
    Object duration = request.arg("duration");
    double seconds =
        (duration instanceof Number n)
            ? n.doubleValue()
            : TimeSpecParser.parseSeconds(String.valueOf(duration), now());
    return resolver
        .resolveTarget(target)
        .flatMapCompletable(mask -> setModeFor(channel, 'q', mask, Optional.of(seconds)))
        .toMaybe();
  }

  public Completable kick(CommandContext ctx, String nick, String reason) {
    return replyOnFailure(ctx, transport.issue(IrcRequests.kick(ctx.channel(), nick, reason)));
  }

  public Completable op(CommandContext ctx, List<String> nicks) {
    return fanOut(ctx, IrcRequests.OP_OP, nicks);
  }

  public Completable deop(CommandContext ctx, List<String> nicks) {
    return fanOut(ctx, IrcRequests.OP_DEOP, nicks);
  }

  public Completable voice(CommandContext ctx, List<String> nicks) {
    return fanOut(ctx, IrcRequests.OP_VOICE, nicks);
  }

  public Completable devoice(CommandContext ctx, List<String> nicks) {
    return fanOut(ctx, IrcRequests.OP_DEVOICE, nicks);
  }

  /** Quiets a nick (by host) or mask, for {@code timeSpec} or the configured default time. */
  public Completable quiet(CommandContext ctx, String target, String timeSpec) {
    Optional<Double> duration;
    try {
      duration = parseOptional(timeSpec);
    } catch (TimeSpecParseException e) {
      ctx.reply(e.getMessage());
      return Completable.complete();
    }
    Optional<Double> effective = duration.isPresent() ? duration : defaultTime();

    Completable work =
        resolver
            .resolveTarget(target)
            .flatMapCompletable(mask -> setModeFor(ctx.channel(), 'q', mask, effective));
    return replyOnFailure(ctx, work)
        .onErrorResumeNext(err -> lookupFailed(ctx, err, target, noSuchNickToQuiet(target)));
  }

  /**
   * Bans a nick (by host), a mask or an extban. Nicks and masks whose nick part has no wildcard are
   * kicked too. A time string that does not parse is used as the kick reason.
   */
  public Completable ban(CommandContext ctx, String target, String timeSpec) {
    String reason = "Banned by " + ctx.nick();
    Optional<Double> duration = Optional.empty();
    if (timeSpec != null && !timeSpec.isBlank()) {
      try {
        duration = Optional.of(TimeSpecParser.parseSeconds(timeSpec, now()));
      } catch (TimeSpecParseException e) {
        reason = timeSpec.trim();
      }
    }
    Optional<Double> effective = duration.isPresent() ? duration : defaultTime();
    String kickReason = reason;
    String t = Objects.toString(target, "").trim();

    Completable work;
    if (t.indexOf('@') >= 0 && t.indexOf('!') >= 0 && t.indexOf('$') < 0) {
      String nick = Hostmasks.nickPart(t);
      work =
          Hostmasks.hasWildcard(nick)
              ? setModeFor(ctx.channel(), 'b', t, effective)
              : banAndKick(ctx.channel(), t, nick, kickReason, effective);
    } else if (Hostmasks.isPlainNick(t)) {
      work =
          resolver
              .resolveTarget(t)
              .flatMapCompletable(
                  mask -> banAndKick(ctx.channel(), mask, t, kickReason, effective));
    } else {
      // Extban or something the server may still understand: ban only.
      work = setModeFor(ctx.channel(), 'b', t, effective);
    }

    return replyOnFailure(ctx, work)
        .onErrorResumeNext(
            err ->
                lookupFailed(
                    ctx,
                    err,
                    t,
                    "There is no user by that nick on the network. Try "
                        + t
                        + "!*@* to ban anyone with that nick, or specify a full hostmask."));
  }

  public Completable unquiet(CommandContext ctx, String target, String timeSpec) {
    return unset(
        ctx,
        'q',
        target,
        timeSpec,
        "There is no user by that nick on the network. Try specifying a full hostmask. "
            + "Use “/mode +q” to see the channel quiet list");
  }

  public Completable unban(CommandContext ctx, String target, String timeSpec) {
    return unset(
        ctx,
        'b',
        target,
        timeSpec,
        "There is no user by that nick on the network. Try specifying a full hostmask. "
            + "Use “/mode +b” to see the channel ban list");
  }

  /**
   * Sends {@code nick} to {@code destChannel} for two hours with a forwarding ban on their
   * username, plus a kick.
   */
  public Completable redirect(CommandContext ctx, String nick, String destChannel) {
    String dest =
        (destChannel == null || destChannel.isBlank()) ? DEFAULT_REDIRECT : destChannel.trim();
    String channel = ctx.channel();

    Single<Redirectee> who =
        transport
            .issueRequest(IrcRequests.whois(nick))
            .cast(WhoisReply.class)
            .map(w -> new Redirectee(w.nick(), "*!" + w.username() + "@*"))
            .switchIfEmpty(Single.error(() -> new NoSuchNickException(nick)))
            .onErrorResumeNext(
                err ->
                    (err instanceof NoSuchNickException)
                        ? Single.just(new Redirectee(nick, nick + "!*@*"))
                        : Single.<Redirectee>error(err));

    Completable work =
        who.flatMapCompletable(
            r -> {
              String mask = r.mask() + "$" + dest;
              Completable ban =
                  setModeFor(channel, 'b', mask, Optional.of((double) REDIRECT_SECONDS));
              Completable kick =
                  transport.issue(IrcRequests.kick(channel, r.nick(), "Redirected to " + dest));
              return Completable.mergeDelayError(List.of(ban, kick))
                  .doOnComplete(
                      () -> ctx.reply("Redirected " + r.nick() + " to " + dest + " for 2 hours"));
            });
    return replyOnFailure(ctx, work)
        .onErrorResumeNext(err -> lookupFailed(ctx, err, nick, null));
  }

  /**
   * A raw mode change. With an {@code in}, {@code at} or {@code after} time string the change is
   * only booked for later; with {@code for}/{@code until} it is applied now and reversed later.
   */
  public Completable mode(CommandContext ctx, String modeSpec, String param, String timeSpec) {
    String spec = Objects.toString(modeSpec, "").trim();
    if (spec.length() != 2 || (spec.charAt(0) != '+' && spec.charAt(0) != '-')) {
      ctx.reply("Modes look like +x or -x");
      return Completable.complete();
    }
    String channel = ctx.channel();

    Optional<Double> when;
    try {
      when = parseOptional(timeSpec);
    } catch (TimeSpecParseException e) {
      ctx.reply(e.getMessage());
      return Completable.complete();
    }

    if (when.isPresent()) {
      String ts = timeSpec.trim().toLowerCase(Locale.ROOT);
      if (ts.startsWith("in") || ts.startsWith("at") || ts.startsWith("after")) {
        double seconds = when.get();
        engine.schedule(seconds, param, channel, spec);
        ctx.reply(
            String.format(
                "Doing a %s %s in %.0f seconds", spec, Objects.toString(param, ""), seconds));
        return Completable.complete();
      }
    }

    Completable work =
        transport
            .issue(IrcRequests.mode(channel, spec, param))
            .doOnComplete(
                () ->
                    when.ifPresent(
                        s -> engine.schedule(s, param, channel, ModeRequests.reverse(spec))));
    return replyOnFailure(ctx, work);
  }

  /** Toggles {@code +m}, opping the caller while the channel is moderated. */
  public Completable moderated(CommandContext ctx) {
    String channel = ctx.channel();
    String nick = ctx.nick();
    Completable work =
        transport
            .issueRequest(IrcRequests.queryChanMode(channel))
            .map(String::valueOf)
            .defaultIfEmpty("")
            .flatMapCompletable(
                modes -> {
                  boolean on = modes.indexOf('m') >= 0;
                  log.info(
                      "[ircbot] {} moderated mode on {}", on ? "Un-setting" : "Setting", channel);
                  Completable mode =
                      transport.issue(IrcRequests.mode(channel, on ? "-m" : "+m", null));
                  String opRequest = on ? IrcRequests.OP_DEOP : IrcRequests.OP_OP;
                  Completable self =
                      transport.issue(IrcRequests.targeted(opRequest, channel, nick));
                  return Completable.mergeDelayError(List.of(mode, self));
                });
    return replyOnFailure(ctx, work);
  }

  /**
   * Sets {@code +letter} on {@code mask} now and, once that succeeded, books {@code -letter} after
   * {@code duration}. Only {@code b} and {@code q} are supported.
   */
  Completable setModeFor(String channel, char letter, String mask, Optional<Double> duration) {
    String request =
        switch (letter) {
          case 'b' -> IrcRequests.OP_BAN;
          case 'q' -> IrcRequests.OP_QUIET;
          default -> throw new IllegalArgumentException("Unsupported timed mode +" + letter);
        };
    if (log.isDebugEnabled()) {
      log.debug(
          "[ircbot] +{} for {} in {} {}",
          letter,
          mask,
          channel,
          duration.map(String::valueOf).orElse("indefinitely"));
    }
    return transport
        .issue(IrcRequests.targeted(request, channel, mask))
        .doOnComplete(
            () -> duration.ifPresent(s -> engine.schedule(s, mask, channel, "-" + letter)));
  }

  private Completable unset(
      CommandContext ctx, char letter, String target, String timeSpec, String noSuchNick) {
    Optional<Double> delay;
    try {
      delay = parseOptional(timeSpec);
    } catch (TimeSpecParseException e) {
      ctx.reply(e.getMessage());
      return Completable.complete();
    }
    String channel = ctx.channel();
    String modeSpec = "-" + letter;

    Completable work =
        resolver
            .resolveTarget(target)
            .flatMapCompletable(
                mask -> {
                  if (delay.isPresent()) {
                    engine.schedule(delay.get(), mask, channel, modeSpec);
                    ctx.reply("It shall be done.");
                    return Completable.complete();
                  }
                  return transport.issue(ModeRequests.requestFor(channel, modeSpec, mask));
                });
    return replyOnFailure(ctx, work)
        .onErrorResumeNext(err -> lookupFailed(ctx, err, target, noSuchNick));
  }

  private Completable banAndKick(
      String channel, String mask, String nick, String reason, Optional<Double> duration) {
    return Completable.mergeDelayError(
        List.of(
            setModeFor(channel, 'b', mask, duration),
            transport.issue(IrcRequests.kick(channel, nick, reason))));
  }

  private Completable fanOut(CommandContext ctx, String requestName, List<String> nicks) {
    List<String> targets =
        (nicks == null || nicks.isEmpty()) ? List.of(ctx.nick()) : List.copyOf(nicks);
    List<Completable> requests = new ArrayList<>(targets.size());
    for (String nick : targets) {
      requests.add(transport.issue(IrcRequests.targeted(requestName, ctx.channel(), nick)));
    }
    return replyOnFailure(ctx, Completable.mergeDelayError(requests));
  }

  /** Answers operator refusals and bad parameters with their message; other errors pass. */
  private static Completable replyOnFailure(CommandContext ctx, Completable work) {
    return work.onErrorResumeNext(
        err -> {
          Throwable cause = firstCause(err);
          if (cause instanceof OperationFailedException
              || cause instanceof InvalidParameterException) {
            ctx.reply(cause.getMessage());
            return Completable.complete();
          }
          return Completable.error(cause);
        });
  }

  private static Completable lookupFailed(
      CommandContext ctx, Throwable err, String nick, String noSuchNick) {
    if (err instanceof NoSuchNickException && noSuchNick != null) {
      ctx.reply(noSuchNick);
      return Completable.complete();
    }
    if (err instanceof WhoisTimeoutException) {
      ctx.reply("That's odd, the whois I did on " + nick + " didn't work. Sorry.");
      return Completable.complete();
    }
    return Completable.error(err);
  }

  private static String noSuchNickToQuiet(String nick) {
    return "There is no user by that nick on the network. Try "
        + nick
        + "!*@* to quiet anyone with that nick, or specify a full hostmask.";
  }

  /** The first failure of a fan-out, or {@code err} itself. */
  static Throwable firstCause(Throwable err) {
    if (err instanceof CompositeException ce && !ce.getExceptions().isEmpty()) {
      return ce.getExceptions().get(0);
    }
    return err;
  }

  private Optional<Double> parseOptional(String timeSpec) {
    if (timeSpec == null || timeSpec.isBlank()) return Optional.empty();
    return Optional.of(TimeSpecParser.parseSeconds(timeSpec, now()));
  }

  private Optional<Double> defaultTime() {
    return config().getSeconds(DEFAULT_TIME);
  }

  private Instant now() {
    return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
  }

  private record Redirectee(String nick, String mask) {}
}
