package cafe.woden.ircbot.admin;

import cafe.woden.ircbot.config.PluginConfig;
import cafe.woden.ircbot.irc.InvalidParameterException;
import cafe.woden.ircbot.irc.IrcEvents;
import cafe.woden.ircbot.irc.OperationFailedException;
import cafe.woden.ircbot.transport.BotRequest;
import cafe.woden.ircbot.transport.Transport;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable "do this mode change later" timers.
 *
 * <p>Every pending action lives twice: as a cancelable timer in {@link #timers} and as a
 * {@code [fireTimestamp, parameter, channel, modeSpec]} entry in the owning plugin's
 * {@value #LATERS} list. Each public method leaves both with the same key set before it returns.
 * After a restart {@link #resync()} rebuilds the timers from the persisted list.
 *
 * <p>Confined to the event loop; the scheduler's clock is the time source.
 */
public final class ScheduledActionEngine {
  private static final Logger log = LoggerFactory.getLogger(ScheduledActionEngine.class);

  public static final String LATERS = "laters";

  private final Transport transport;
  private final Supplier<PluginConfig> config;
  private final Scheduler scheduler;

  private final Map<PendingActionKey, Disposable> timers = new LinkedHashMap<>();

  public ScheduledActionEngine(
      Transport transport, Supplier<PluginConfig> config, Scheduler scheduler) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.config = Objects.requireNonNull(config, "config");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /**
   * Books {@code modeSpec} with {@code parameter} on {@code channel} in {@code delaySeconds}
   * (at least one second). Replaces any pending action with the same key.
   */
  public void schedule(double delaySeconds, String parameter, String channel, String modeSpec) {
    PendingActionKey key = new PendingActionKey(parameter, channel, modeSpec);
    double delay = Math.max(1, delaySeconds);

    cancelTimer(key);
    PluginConfig cfg = config.get();
    List<Object> laters = cfg.getOrCreateList(LATERS);
    removePersisted(laters, key);

    arm(key, delay);
    laters.add(entry(nowSeconds() + delay, key));
    cfg.save();

    log.info(
        "[ircbot] Setting {} on {} in {} in {} seconds",
        key.modeSpec(),
        key.parameter(),
        key.channel(),
        Math.round(delay));
  }

  /**
   * Cancels every live timer and re-arms one per persisted entry, keeping each entry's original
   * fire time. Overdue entries fire after one second. Duplicate or malformed entries are dropped.
   */
  public void resync() {
    cancelAll();

    PluginConfig cfg = config.get();
    List<Object> laters = cfg.getOrCreateList(LATERS);
    double now = nowSeconds();

    Map<PendingActionKey, Double> byKey = new LinkedHashMap<>();
    for (Object o : laters) {
      PersistedAction parsed = PersistedAction.parse(o);
      if (parsed == null) {
        log.warn("[ircbot] Dropping malformed scheduled action entry {}", o);
        continue;
      }
      byKey.remove(parsed.key());
      byKey.put(parsed.key(), parsed.fireAt());
    }

    boolean changed = byKey.size() != laters.size();
    laters.clear();
    byKey.forEach(
        (key, fireAt) -> {
          arm(key, Math.max(1, fireAt - now));
          laters.add(entry(fireAt, key));
        });
    if (changed) {
      cfg.save();
    }

    if (!byKey.isEmpty()) {
      log.info("[ircbot] Restored {} scheduled action(s)", byKey.size());
    }
  }

  /**
   * Drops the pending action for this exact key because it is known to have happened already.
   *
   * @return false (and no change) if nothing was pending for the key
   */
  public boolean invalidate(String parameter, String channel, String modeSpec) {
    PendingActionKey key = new PendingActionKey(parameter, channel, modeSpec);
    Disposable timer = timers.remove(key);
    if (timer == null) return false;
    timer.dispose();

    PluginConfig cfg = config.get();
    removePersisted(cfg.getOrCreateList(LATERS), key);
    cfg.save();
    log.info(
        "[ircbot] Cancelled pending {} on {} in {}: already done",
        key.modeSpec(),
        key.parameter(),
        key.channel());
    return true;
  }

  /** Cancels all live timers. The persisted list is left for the next {@link #resync()}. */
  public void stop() {
    cancelAll();
  }

  public Set<PendingActionKey> pendingKeys() {
    return Set.copyOf(timers.keySet());
  }

  public Set<PendingActionKey> persistedKeys() {
    Set<PendingActionKey> out = new LinkedHashSet<>();
    for (Object o : config.get().getOrCreateList(LATERS)) {
      PersistedAction parsed = PersistedAction.parse(o);
      if (parsed != null) out.add(parsed.key());
    }
    return out;
  }

  private void arm(PendingActionKey key, double delaySeconds) {
    long delayMs = Math.max(1_000L, Math.round(delaySeconds * 1000));
    Disposable timer =
        Completable.timer(delayMs, TimeUnit.MILLISECONDS, scheduler)
            .subscribe(
                () -> fire(key),
                err -> log.error("[ircbot] Timer for {} failed", key, err));
    timers.put(key, timer);
  }

  private void fire(PendingActionKey key) {
    log.info(
        "[ircbot] timed request: {} for {} in {}", key.modeSpec(), key.parameter(), key.channel());

    timers.remove(key);
    PluginConfig cfg = config.get();
    removePersisted(cfg.getOrCreateList(LATERS), key);
    try {
      cfg.save();
    } catch (UncheckedIOException e) {
      log.error("[ircbot] Could not persist removal of fired action {}", key, e);
    }

    BotRequest request = ModeRequests.requestFor(key);
    transport
        .issue(request)
        .subscribe(
            () -> log.debug("[ircbot] timed request {} for {} completed", request.name(), key),
            err -> onActionFailed(key, err));
  }

  private void onActionFailed(PendingActionKey key, Throwable err) {
    if (err instanceof OperationFailedException || err instanceof InvalidParameterException) {
      log.warn(
          "[ircbot] Scheduled {} for {} in {} failed: {}",
          key.modeSpec(),
          key.parameter(),
          key.channel(),
          err.getMessage());
      String notice =
          String.format(
              "I was about to do a %s %s, but %s",
              key.modeSpec(), key.parameter(), err.getMessage());
      transport.sendEvent(IrcEvents.sendMessage(key.channel(), notice));
      return;
    }
    log.error(
        "[ircbot] Scheduled {} for {} in {} failed",
        key.modeSpec(),
        key.parameter(),
        key.channel(),
        err);
  }

  private void cancelTimer(PendingActionKey key) {
    Disposable prev = timers.remove(key);
    if (prev != null) prev.dispose();
  }

  private void cancelAll() {
    for (Disposable d : timers.values()) {
      d.dispose();
    }
    timers.clear();
  }

  private double nowSeconds() {
    return scheduler.now(TimeUnit.MILLISECONDS) / 1000.0;
  }

  private static void removePersisted(List<Object> laters, PendingActionKey key) {
    laters.removeIf(
        o -> {
          PersistedAction parsed = PersistedAction.parse(o);
          return parsed == null || parsed.key().equals(key);
        });
  }

  private static List<Object> entry(double fireAt, PendingActionKey key) {
    List<Object> e = new ArrayList<>(4);
    e.add(fireAt);
    e.add(key.parameter());
    e.add(key.channel());
    e.add(key.modeSpec());
    return e;
  }

  /** One decoded {@value #LATERS} entry. */
  record PersistedAction(double fireAt, PendingActionKey key) {
    static PersistedAction parse(Object o) {
      if (!(o instanceof List<?> list) || list.size() != 4) return null;
      if (!(list.get(0) instanceof Number ts)) return null;
      if (list.get(2) == null || list.get(3) == null) return null;
      try {
        return new PersistedAction(
            ts.doubleValue(),
            new PendingActionKey(
                Objects.toString(list.get(1), ""),
                String.valueOf(list.get(2)),
                String.valueOf(list.get(3))));
      } catch (IllegalArgumentException e) {
        return null;
      }
    }
  }
}
