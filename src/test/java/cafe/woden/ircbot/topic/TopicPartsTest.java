package cafe.woden.ircbot.topic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class TopicPartsTest {

  @Test
  void splitTrimsSegmentsAndTreatsBlankAsEmpty() {
    assertEquals(List.of("a", "b", "c"), TopicParts.split("  a|b |  c "));
    assertEquals(List.of(), TopicParts.split("   "));
    assertEquals(List.of("a", ""), TopicParts.split("a |"));
  }

  @Test
  void appendToEmptyTopicStartsFresh() {
    assertEquals("gamma", TopicParts.append("", "gamma"));
  }

  @Test
  void insertAcceptsTheEndAndNegativePositions() {
    assertEquals("x | a | b", TopicParts.insert("a | b", 0, "x"));
    assertEquals("a | b | x", TopicParts.insert("a | b", 2, "x"));
    assertEquals("a | x | b", TopicParts.insert("a | b", -1, "x"));
    assertThrows(TopicPositionException.class, () -> TopicParts.insert("a | b", 3, "x"));
    assertThrows(TopicPositionException.class, () -> TopicParts.insert("a | b", -3, "x"));
  }

  @Test
  void negativePositionsCountFromTheEnd() {
    assertEquals("a | b | Z", TopicParts.replace("a | b | c", -1, "Z"));
    assertEquals("b | c", TopicParts.remove("a | b | c", -3));
    assertThrows(TopicPositionException.class, () -> TopicParts.remove("a | b | c", -4));
  }

  @Test
  void popOfEmptyTopicReportsNoParts() {
    TopicPositionException e =
        assertThrows(TopicPositionException.class, () -> TopicParts.pop(""));
    assertEquals(0, e.parts());
  }
}
