package cafe.woden.ircbot.plugin;

import cafe.woden.ircbot.transport.BotRequest;
import io.reactivex.rxjava3.core.Maybe;

/** Capability: serves named requests issued by other plugins. */
public interface RequestHandler {
  Maybe<Object> incomingRequest(BotRequest request);
}
