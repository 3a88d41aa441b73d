package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.config.PluginConfig;
import cafe.woden.ircbot.transport.BotEvent;
import cafe.woden.ircbot.transport.BotRequest;
import cafe.woden.ircbot.transport.RequestNotImplementedException;
import cafe.woden.ircbot.transport.Transport;
import io.reactivex.rxjava3.core.Maybe;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Base class for plugins: holds the config handle, the lifecycle state and the
 * {@link PluginHandlers} table, and implements the three dispatch capabilities as table lookups.
 *
 * <p>Subclasses register handlers from {@link #onStart()} through {@link #onEvent},
 * {@link #onMiddleware} and {@link #onRequest}. The initial {@link #reload()} is issued by the
 * {@link PluginRegistry} right after construction, once subclass fields exist.
 */
public abstract class AbstractBotPlugin
    implements BotPlugin, EventListener, MiddlewareInterceptor, RequestHandler {

  private final String name;
  protected final Transport transport;
  protected final PluginRegistry registry;
  private final PluginHandlers handlers = new PluginHandlers();
  private PluginConfig config;
  private PluginState state = PluginState.CONSTRUCTED;

  protected AbstractBotPlugin(String name, Transport transport, PluginRegistry registry) {
    this.name = Objects.requireNonNull(name, "name");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final PluginState state() {
    return state;
  }

  /** The current config handle; replaced on every reload. */
  protected final PluginConfig config() {
    if (config == null) {
      throw new IllegalStateException("Plugin " + name + " has not been configured yet");
    }
    return config;
  }

  @Override
  public final void reload() {
    config = registry.getPluginConfig(name);
    onReload(config);
    if (state != PluginState.STARTED) {
      state = PluginState.CONFIGURED;
    }
  }

  @Override
  public final void start() {
    if (state == PluginState.CONSTRUCTED) {
      throw new IllegalStateException("Plugin " + name + " must be configured before start");
    }
    if (state == PluginState.STARTED) return;
    try {
      onStart();
    } catch (RuntimeException e) {
      // Tear down whatever onStart already set up, timers included.
      try {
        onStop();
      } catch (RuntimeException stopFailure) {
        e.addSuppressed(stopFailure);
      } finally {
        transport.unhookPlugin(this);
        handlers.clear();
        state = PluginState.STOPPED;
      }
      throw e;
    }
    state = PluginState.STARTED;
  }

  @Override
  public final void stop() {
    try {
      onStop();
    } finally {
      transport.unhookPlugin(this);
      handlers.clear();
      state = PluginState.STOPPED;
    }
  }

  protected void onReload(PluginConfig config) {}

  protected void onStart() {}

  protected void onStop() {}

  protected final boolean isStarted() {
    return state == PluginState.STARTED;
  }

  protected final void onEvent(String eventType, Consumer<BotEvent> handler) {
    handlers.putEvent(eventType, handler);
    transport.listenForEvent(eventType, this);
  }

  protected final void onMiddleware(
      String eventType, Function<BotEvent, Optional<BotEvent>> handler) {
    handlers.putMiddleware(eventType, handler);
    transport.installMiddleware(eventType, this);
  }

  protected final void onRequest(String requestName, Function<BotRequest, Maybe<Object>> handler) {
    handlers.putRequest(requestName, handler);
    transport.providesRequest(requestName, this);
  }

  final PluginHandlers handlers() {
    return handlers;
  }

  @Override
  public void receivedEvent(BotEvent event) {
    handlers.eventHandler(event.type()).ifPresent(h -> h.accept(event));
  }

  @Override
  public Optional<BotEvent> receivedMiddlewareEvent(BotEvent event) {
    Optional<Function<BotEvent, Optional<BotEvent>>> handler =
        handlers.middlewareHandler(event.type());
    if (handler.isEmpty()) return Optional.of(event);
    Optional<BotEvent> out = handler.get().apply(event);
    return (out == null) ? Optional.empty() : out;
  }

  @Override
  public Maybe<Object> incomingRequest(BotRequest request) {
    Optional<Function<BotRequest, Maybe<Object>>> handler =
        handlers.requestHandler(request.name());
    if (handler.isEmpty()) {
      return Maybe.error(new RequestNotImplementedException(request.name()));
    }
    return Maybe.defer(() -> handler.get().apply(request));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + ", " + state + "]";
  }
}
