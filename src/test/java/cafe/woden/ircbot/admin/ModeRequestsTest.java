package cafe.woden.ircbot.admin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircbot.irc.IrcRequests;
import cafe.woden.ircbot.transport.BotRequest;
import org.junit.jupiter.api.Test;

class ModeRequestsTest {

  @Test
  void knownLettersMapToNamedRequests() {
    assertEquals(IrcRequests.OP_UNQUIET, ModeRequests.namedRequestFor("-q").orElseThrow());
    assertEquals(IrcRequests.OP_BAN, ModeRequests.namedRequestFor("+b").orElseThrow());
    assertEquals(IrcRequests.OP_DEVOICE, ModeRequests.namedRequestFor("-v").orElseThrow());
    assertTrue(ModeRequests.namedRequestFor("+m").isEmpty());
  }

  @Test
  void pendingKeyBecomesTargetedRequest() {
    BotRequest request = ModeRequests.requestFor(new PendingActionKey("x!*@*", "#a", "-b"));

    assertEquals(IrcRequests.OP_UNBAN, request.name());
    assertEquals("#a", request.arg("channel"));
    assertEquals("x!*@*", request.arg("target"));
  }

  @Test
  void unknownLetterFallsBackToGenericMode() {
    BotRequest request = ModeRequests.requestFor("#a", "+j", "3:10");

    assertEquals(IrcRequests.OP_MODE, request.name());
    assertEquals("+j", request.arg("mode"));
    assertEquals("3:10", request.arg("param"));
  }

  @Test
  void reverseFlipsTheSign() {
    assertEquals("-q", ModeRequests.reverse("+q"));
    assertEquals("+m", ModeRequests.reverse("-m"));
  }
}
