package cafe.woden.ircbot.transport;

import cafe.woden.ircbot.plugin.BotPlugin;
import cafe.woden.ircbot.plugin.EventListener;
import cafe.woden.ircbot.plugin.MiddlewareInterceptor;
import cafe.woden.ircbot.plugin.RequestHandler;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;

/**
 * The bus shared by all plugins.
 *
 * <p>All methods must be called from the bot event loop. Request completions are expected on the
 * event loop too; adapters that finish work on I/O threads hop back before signalling.
 */
public interface Transport {

  /** Runs the middleware chain for the event's type, then delivers it to listeners in order. */
  void sendEvent(BotEvent event);

  /**
   * Resolves {@code request} to its provider.
   *
   * <p>The result is empty for requests that carry no value. Fails with
   * {@link RequestNotImplementedException} if no started plugin provides the name.
   */
  Maybe<Object> issueRequest(BotRequest request);

  /** Convenience for requests whose value is not needed. */
  default Completable issue(BotRequest request) {
    return issueRequest(request).ignoreElement();
  }

  <P extends BotPlugin & EventListener> void listenForEvent(String eventType, P plugin);

  <P extends BotPlugin & MiddlewareInterceptor> void installMiddleware(String eventType, P plugin);

  <P extends BotPlugin & RequestHandler> void providesRequest(String requestName, P plugin);

  /** Removes every listener, middleware and request registration of {@code plugin}. */
  void unhookPlugin(BotPlugin plugin);
}
