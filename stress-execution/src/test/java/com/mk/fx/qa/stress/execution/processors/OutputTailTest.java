package com.mk.fx.qa.stress.execution.processors;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class OutputTailTest {

  @Test
  void keepsOnlyTheLastLines() {
    OutputTail tail = new OutputTail(2);
    tail.add("one");
    tail.add("two");
    tail.add("three");

    assertEquals("... 1 earlier lines omitted\ntwo\nthree", tail.asText());
  }

  @Test
  void emptyTail() {
    OutputTail tail = new OutputTail(3);
    assertTrue(tail.isEmpty());
    assertEquals("", tail.asText());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new OutputTail(0));
  }
}
