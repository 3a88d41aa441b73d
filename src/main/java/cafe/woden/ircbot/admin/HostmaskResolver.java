package cafe.woden.ircbot.admin;

import cafe.woden.ircbot.irc.Hostmasks;
import cafe.woden.ircbot.irc.IrcRequests;
import cafe.woden.ircbot.irc.NoSuchNickException;
import cafe.woden.ircbot.irc.WhoisReply;
import cafe.woden.ircbot.transport.Transport;
import io.reactivex.rxjava3.core.Single;
import java.util.Objects;

/**
 * Turns a nick into a ban/quiet mask that matches every client from the same host.
 *
 * <p>Masks and extbans pass through unchanged. Nicks go through a {@code directory.whois} lookup,
 * which may fail with {@link NoSuchNickException} or
 * {@link cafe.woden.ircbot.irc.WhoisTimeoutException}.
 */
public final class HostmaskResolver {
  static final String WEB_GATEWAY_PREFIX = "gateway/web/freenode/ip.";
  static final String GATEWAY_PREFIX = "gateway/";

  private final Transport transport;

  public HostmaskResolver(Transport transport) {
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  public Single<String> resolveTarget(String nickOrMask) {
    String target = Objects.toString(nickOrMask, "").trim();
    if (Hostmasks.isMaskOrExtban(target)) {
      return Single.just(target);
    }
    return transport
        .issueRequest(IrcRequests.whois(target))
        .switchIfEmpty(Single.error(() -> new NoSuchNickException(target)))
        .cast(WhoisReply.class)
        .map(HostmaskResolver::maskFor);
  }

  /** Mask for a looked-up user; see the class docs for the gateway rules. */
  public static String maskFor(WhoisReply whois) {
    String host = whois.host();
    if (host.startsWith(WEB_GATEWAY_PREFIX)) {
      // "gateway/web/freenode/ip.1.2.3.4": ban the embedded address.
      return "*!*@" + host.substring(WEB_GATEWAY_PREFIX.length());
    }
    if (host.startsWith(GATEWAY_PREFIX)) {
      return "*!" + whois.username() + "@gateway/*";
    }
    return "*!*@" + host;
  }
}
