package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.transport.BotEvent;

/** Capability: receives events after the middleware chain has run. */
public interface EventListener {
  void receivedEvent(BotEvent event);
}
