package cafe.woden.ircbot.admin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.ircbot.irc.NoSuchNickException;
import cafe.woden.ircbot.irc.WhoisReply;
import cafe.woden.ircbot.irc.WhoisTimeoutException;
import cafe.woden.ircbot.transport.BotRequest;
import cafe.woden.ircbot.transport.Transport;
import io.reactivex.rxjava3.core.Maybe;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class HostmaskResolverTest {

  private final Transport transport = mock(Transport.class);
  private final HostmaskResolver resolver = new HostmaskResolver(transport);

  @Test
  void nickResolvesToItsHost() {
    when(transport.issueRequest(any()))
        .thenReturn(Maybe.just(new WhoisReply("bob", "~bob", "unaffiliated/bob")));

    resolver.resolveTarget("bob").test().assertValue("*!*@unaffiliated/bob");

    ArgumentCaptor<BotRequest> captor = ArgumentCaptor.forClass(BotRequest.class);
    verify(transport).issueRequest(captor.capture());
    assertEquals("directory.whois", captor.getValue().name());
    assertEquals("bob", captor.getValue().arg("nick"));
  }

  @Test
  void masksAndExtbansPassThroughWithoutLookup() {
    resolver.resolveTarget("x!*@*").test().assertValue("x!*@*");
    resolver.resolveTarget("$a:bob").test().assertValue("$a:bob");

    verify(transport, never()).issueRequest(any());
  }

  @Test
  void webGatewayUsersAreMatchedByAddress() {
    assertEquals(
        "*!*@1.2.3.4",
        HostmaskResolver.maskFor(new WhoisReply("bob", "~bob", "gateway/web/freenode/ip.1.2.3.4")));
  }

  @Test
  void webGatewayAddressIsEverythingAfterThePrefix() {
    assertEquals(
        "*!*@10.0.0.1/ab",
        HostmaskResolver.maskFor(
            new WhoisReply("bob", "~bob", "gateway/web/freenode/ip.10.0.0.1/ab")));
    assertEquals(
        "*!*@",
        HostmaskResolver.maskFor(new WhoisReply("bob", "~bob", "gateway/web/freenode/ip.")));
  }

  @Test
  void otherGatewayUsersAreMatchedByUsername() {
    assertEquals(
        "*!~bob@gateway/*",
        HostmaskResolver.maskFor(new WhoisReply("bob", "~bob", "gateway/tor-sasl/bob")));
  }

  @Test
  void emptyWhoisMeansNoSuchNick() {
    when(transport.issueRequest(any())).thenReturn(Maybe.empty());

    resolver.resolveTarget("ghost").test().assertError(NoSuchNickException.class);
  }

  @Test
  void lookupErrorsPropagate() {
    when(transport.issueRequest(any()))
        .thenReturn(Maybe.error(new WhoisTimeoutException("slow")));

    resolver.resolveTarget("slow").test().assertError(WhoisTimeoutException.class);
  }
}
