package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.transport.BotEvent;
import java.util.Optional;

/** Capability: sees an event before listeners do and may rewrite or swallow it. */
public interface MiddlewareInterceptor {

  /**
   * @return the event to continue with (possibly modified), or empty to stop propagation to later
   *     middleware and to all listeners
   */
  Optional<BotEvent> receivedMiddlewareEvent(BotEvent event);
}
