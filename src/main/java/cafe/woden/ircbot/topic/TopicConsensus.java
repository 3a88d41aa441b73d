package cafe.woden.ircbot.topic;

import cafe.woden.ircbot.irc.IrcRequests;
import cafe.woden.ircbot.transport.Transport;
import cafe.woden.ircbot.util.RestartableRxTimer;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.core.SingleEmitter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What the bot believes each channel's topic to be.
 *
 * <p>History is fed by observed {@code topic.updated} events. When nothing is known yet, a single
 * {@code protocol.fetchTopic} request is issued per channel and every caller waits on its answer;
 * after {@link #QUERY_TIMEOUT_SECONDS} without one, all of them fail with
 * {@link TopicUnavailableException} and the next caller starts over.
 *
 * <p>Event-loop confined.
 */
public final class TopicConsensus {
  private static final Logger log = LoggerFactory.getLogger(TopicConsensus.class);

  public static final long QUERY_TIMEOUT_SECONDS = 10;

  private final Transport transport;
  private final Scheduler scheduler;

  private final Map<String, TopicHistory> histories = new HashMap<>();
  private final Map<String, PendingQuery> pending = new HashMap<>();

  public TopicConsensus(Transport transport, Scheduler scheduler) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /** Records a topic seen on the channel and answers everyone waiting for it. */
  public void onObservedTopic(String channel, String topic) {
    String t = Objects.toString(topic, "");
    TopicHistory history = history(channel);
    if (history.push(t)) {
      log.info(
          "[ircbot] Topic updated in {}. Now I know about {} past topics (including this one)",
          channel,
          history.size());
    }

    PendingQuery query = pending.remove(channel);
    if (query != null) {
      query.timer.stop();
      for (SingleEmitter<String> waiter : query.drain()) {
        waiter.onSuccess(t);
      }
    }
  }

  /** The top of the channel's history, or the answer to a (shared) fetch. */
  public Single<String> currentTopic(String channel) {
    return Single.defer(
        () -> {
          Optional<String> known = history(channel).top();
          if (known.isPresent()) return Single.just(known.get());
          return Single.create(emitter -> await(channel, emitter));
        });
  }

  public Completable append(String channel, String text) {
    return edit(channel, topic -> TopicParts.append(topic, text));
  }

  public Completable insert(String channel, int pos, String text) {
    return edit(channel, topic -> TopicParts.insert(topic, pos, text));
  }

  public Completable replace(String channel, int pos, String text) {
    return edit(channel, topic -> TopicParts.replace(topic, pos, text));
  }

  public Completable remove(String channel, int pos) {
    return edit(channel, topic -> TopicParts.remove(topic, pos));
  }

  public Completable pop(String channel) {
    return edit(channel, TopicParts::pop);
  }

  /**
   * Drops the current topic from history and sets the one before it. Fails with
   * {@link NothingToUndoException}, issuing nothing, when fewer than two topics are known.
   */
  public Completable undo(String channel) {
    return Completable.defer(
        () -> {
          TopicHistory history = history(channel);
          if (history.size() < 2) {
            return Completable.error(new NothingToUndoException());
          }
          history.pop();
          // The restored topic is pushed again once the server echoes it.
          String previous = history.pop().orElseThrow();
          return setTopic(channel, previous);
        });
  }

  public Completable setTopic(String channel, String topic) {
    return transport.issue(IrcRequests.setTopic(channel, topic));
  }

  /** The channel's history, created empty on first use. */
  public TopicHistory history(String channel) {
    Objects.requireNonNull(channel, "channel");
    return histories.computeIfAbsent(channel, c -> new TopicHistory());
  }

  public boolean isQueryPending(String channel) {
    return pending.containsKey(channel);
  }

  /** Fails every waiter and forgets all history. */
  public void clear() {
    List<Map.Entry<String, PendingQuery>> queries = new ArrayList<>(pending.entrySet());
    pending.clear();
    for (Map.Entry<String, PendingQuery> e : queries) {
      e.getValue().timer.stop();
      for (SingleEmitter<String> waiter : e.getValue().drain()) {
        waiter.tryOnError(new TopicUnavailableException(e.getKey()));
      }
    }
    histories.clear();
  }

  private Completable edit(String channel, UnaryOperator<String> change) {
    return currentTopic(channel)
        .map(change::apply)
        .flatMapCompletable(newTopic -> setTopic(channel, newTopic));
  }

  private void await(String channel, SingleEmitter<String> emitter) {
    PendingQuery query = pending.get(channel);
    boolean first = (query == null);
    if (first) {
      query = new PendingQuery(channel);
      pending.put(channel, query);
    }
    query.waiters.add(emitter);
    PendingQuery q = query;
    emitter.setCancellable(() -> q.waiters.remove(emitter));

    if (!first) return;
    log.info("[ircbot] Requesting the topic of {} since I don't know it", channel);
    query.timer.restart(QUERY_TIMEOUT_SECONDS, TimeUnit.SECONDS, () -> expire(channel, q, null));
    transport
        .issue(IrcRequests.fetchTopic(channel))
        .subscribe(() -> {}, err -> expire(channel, q, err));
  }

  private void expire(String channel, PendingQuery query, Throwable cause) {
    if (pending.get(channel) != query) return;
    pending.remove(channel);
    query.timer.stop();
    if (cause == null) {
      log.info("[ircbot] Topic request for {} timed out", channel);
    } else {
      log.warn("[ircbot] Topic request for {} failed: {}", channel, cause.toString());
    }
    for (SingleEmitter<String> waiter : query.drain()) {
      waiter.tryOnError(
          cause == null
              ? new TopicUnavailableException(channel)
              : new TopicUnavailableException(channel, cause));
    }
  }

  /** Waiters on one in-flight fetch, plus its timeout. */
  private final class PendingQuery {
    final List<SingleEmitter<String>> waiters = new ArrayList<>();
    final RestartableRxTimer timer;

    PendingQuery(String channel) {
      this.timer =
          new RestartableRxTimer(
              scheduler, err -> log.error("[ircbot] Topic timeout for {} failed", channel, err));
    }

    List<SingleEmitter<String>> drain() {
      List<SingleEmitter<String>> out = new ArrayList<>(waiters);
      waiters.clear();
      return out;
    }
  }
}
