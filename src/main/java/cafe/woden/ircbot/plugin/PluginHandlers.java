package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.transport.BotEvent;
import cafe.woden.ircbot.transport.BotRequest;
import io.reactivex.rxjava3.core.Maybe;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Per-plugin dispatch table from event types and request names to handler closures.
 *
 * <p>Lookups are exact and case-sensitive. Filled during {@link BotPlugin#start()}, cleared on
 * stop.
 */
public final class PluginHandlers {

  private final Map<String, Consumer<BotEvent>> events = new LinkedHashMap<>();
  private final Map<String, Function<BotEvent, Optional<BotEvent>>> middleware =
      new LinkedHashMap<>();
  private final Map<String, Function<BotRequest, Maybe<Object>>> requests = new LinkedHashMap<>();

  void putEvent(String eventType, Consumer<BotEvent> handler) {
    events.put(eventType, Objects.requireNonNull(handler, "handler"));
  }

  void putMiddleware(String eventType, Function<BotEvent, Optional<BotEvent>> handler) {
    middleware.put(eventType, Objects.requireNonNull(handler, "handler"));
  }

  void putRequest(String requestName, Function<BotRequest, Maybe<Object>> handler) {
    requests.put(requestName, Objects.requireNonNull(handler, "handler"));
  }

  public Optional<Consumer<BotEvent>> eventHandler(String eventType) {
    return Optional.ofNullable(events.get(eventType));
  }

  public Optional<Function<BotEvent, Optional<BotEvent>>> middlewareHandler(String eventType) {
    return Optional.ofNullable(middleware.get(eventType));
  }

  public Optional<Function<BotRequest, Maybe<Object>>> requestHandler(String requestName) {
    return Optional.ofNullable(requests.get(requestName));
  }

  public boolean isEmpty() {
    return events.isEmpty() && middleware.isEmpty() && requests.isEmpty();
  }

  void clear() {
    events.clear();
    middleware.clear();
    requests.clear();
  }
}
