package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.config.PluginConfig;
import cafe.woden.ircbot.transport.BotEvent;
import cafe.woden.ircbot.transport.BotRequest;
import cafe.woden.ircbot.transport.Transport;
import io.reactivex.rxjava3.core.Maybe;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/** Plugin whose start-time registrations are supplied by the test. Records lifecycle calls. */
public class ScriptedPlugin extends AbstractBotPlugin {

  public final List<String> lifecycle = new ArrayList<>();

  private final Consumer<ScriptedPlugin> setup;
  private List<String> requires = List.of();
  private RuntimeException startFailure;

  public ScriptedPlugin(
      String name, Transport transport, PluginRegistry registry, Consumer<ScriptedPlugin> setup) {
    super(name, transport, registry);
    this.setup = setup;
  }

  public ScriptedPlugin requiring(String... names) {
    this.requires = List.of(names);
    return this;
  }

  /** Registrations made by the setup stay in place; the failure is thrown afterwards. */
  public ScriptedPlugin failingStartWith(RuntimeException failure) {
    this.startFailure = failure;
    return this;
  }

  @Override
  public List<String> requires() {
    return requires;
  }

  @Override
  protected void onReload(PluginConfig config) {
    lifecycle.add("reload");
  }

  @Override
  protected void onStart() {
    lifecycle.add("start");
    setup.accept(this);
    if (startFailure != null) throw startFailure;
  }

  @Override
  protected void onStop() {
    lifecycle.add("stop");
  }

  public PluginConfig currentConfig() {
    return config();
  }

  public void listen(String eventType, Consumer<BotEvent> handler) {
    onEvent(eventType, handler);
  }

  public void intercept(String eventType, Function<BotEvent, Optional<BotEvent>> handler) {
    onMiddleware(eventType, handler);
  }

  public void serve(String requestName, Function<BotRequest, Maybe<Object>> handler) {
    onRequest(requestName, handler);
  }
}
