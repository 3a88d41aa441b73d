package cafe.woden.ircbot.transport;

import cafe.woden.ircbot.plugin.BotPlugin;
import cafe.woden.ircbot.plugin.EventListener;
import cafe.woden.ircbot.plugin.MiddlewareInterceptor;
import cafe.woden.ircbot.plugin.PluginState;
import cafe.woden.ircbot.plugin.RequestHandler;
import io.reactivex.rxjava3.core.Maybe;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process {@link Transport}.
 *
 * <p>Registration tables are plain collections confined to the event loop. Only plugins in the
 * {@link PluginState#STARTED} state receive events, middleware calls or requests.
 */
@Component
public class LocalTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(LocalTransport.class);

  private final Map<String, List<Registration<EventListener>>> listeners = new LinkedHashMap<>();
  private final Map<String, List<Registration<MiddlewareInterceptor>>> middleware =
      new LinkedHashMap<>();
  private final Map<String, Registration<RequestHandler>> providers = new LinkedHashMap<>();

  @Override
  public void sendEvent(BotEvent event) {
    Objects.requireNonNull(event, "event");
    String type = event.type();

    BotEvent current = event;
    for (Registration<MiddlewareInterceptor> reg : snapshot(middleware.get(type))) {
      if (!reg.isLive()) continue;
      Optional<BotEvent> next;
      try {
        next = reg.capability().receivedMiddlewareEvent(current);
      } catch (RuntimeException e) {
        // A broken middleware is skipped; the event continues unchanged.
        log.error("[ircbot] middleware {} failed on event {}", reg.plugin().name(), type, e);
        continue;
      }
      if (next == null || next.isEmpty()) {
        if (log.isDebugEnabled()) {
          log.debug("[ircbot] event {} swallowed by middleware {}", type, reg.plugin().name());
        }
        return;
      }
      current = next.get();
    }

    for (Registration<EventListener> reg : snapshot(listeners.get(type))) {
      if (!reg.isLive()) continue;
      try {
        reg.capability().receivedEvent(current);
      } catch (RuntimeException e) {
        log.error("[ircbot] plugin {} failed handling event {}", reg.plugin().name(), type, e);
      }
    }
  }

  @Override
  public Maybe<Object> issueRequest(BotRequest request) {
    Objects.requireNonNull(request, "request");
    Registration<RequestHandler> reg = providers.get(request.name());
    if (reg == null || !reg.isLive()) {
      return Maybe.error(new RequestNotImplementedException(request.name()));
    }
    return Maybe.defer(() -> reg.capability().incomingRequest(request));
  }

  @Override
  public <P extends BotPlugin & EventListener> void listenForEvent(String eventType, P plugin) {
    List<Registration<EventListener>> regs =
        listeners.computeIfAbsent(requireName(eventType), k -> new ArrayList<>());
    if (regs.stream().noneMatch(r -> r.plugin() == plugin)) {
      regs.add(new Registration<>(plugin, plugin));
    }
  }

  @Override
  public <P extends BotPlugin & MiddlewareInterceptor> void installMiddleware(
      String eventType, P plugin) {
    List<Registration<MiddlewareInterceptor>> regs =
        middleware.computeIfAbsent(requireName(eventType), k -> new ArrayList<>());
    if (regs.stream().noneMatch(r -> r.plugin() == plugin)) {
      regs.add(new Registration<>(plugin, plugin));
    }
  }

  @Override
  public <P extends BotPlugin & RequestHandler> void providesRequest(String requestName, P plugin) {
    Registration<RequestHandler> prev =
        providers.put(requireName(requestName), new Registration<>(plugin, plugin));
    if (prev != null && prev.plugin() != plugin) {
      log.warn(
          "[ircbot] request {} was provided by {}, now by {}",
          requestName,
          prev.plugin().name(),
          plugin.name());
    }
  }

  @Override
  public void unhookPlugin(BotPlugin plugin) {
    if (plugin == null) return;
    listeners.values().forEach(regs -> regs.removeIf(r -> r.plugin() == plugin));
    listeners.values().removeIf(List::isEmpty);
    middleware.values().forEach(regs -> regs.removeIf(r -> r.plugin() == plugin));
    middleware.values().removeIf(List::isEmpty);
    providers.values().removeIf(r -> r.plugin() == plugin);
  }

  /** True if {@code plugin} still has any registration. */
  public boolean isHooked(BotPlugin plugin) {
    return listeners.values().stream().flatMap(List::stream).anyMatch(r -> r.plugin() == plugin)
        || middleware.values().stream().flatMap(List::stream).anyMatch(r -> r.plugin() == plugin)
        || providers.values().stream().anyMatch(r -> r.plugin() == plugin);
  }

  private static <T> List<T> snapshot(List<T> regs) {
    return (regs == null) ? List.of() : List.copyOf(regs);
  }

  private static String requireName(String name) {
    String n = Objects.requireNonNull(name, "name").trim();
    if (n.isEmpty()) throw new IllegalArgumentException("name is blank");
    return n;
  }

  private record Registration<C>(BotPlugin plugin, C capability) {
    boolean isLive() {
      return plugin.state() == PluginState.STARTED;
    }
  }
}
