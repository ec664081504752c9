package com.mk.fx.qa.stress.execution.processors;

import java.util.ArrayDeque;
import java.util.Deque;

/** Keeps the last {@code capacity} lines of a process output. Not thread-safe. */
public class OutputTail {

  private final int capacity;
  private final Deque<String> lines;
  private long dropped;

  public OutputTail(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.lines = new ArrayDeque<>(capacity);
  }

  public void add(String line) {
    if (lines.size() == capacity) {
      lines.pollFirst();
      dropped++;
    }
    lines.addLast(line);
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public String asText() {
    StringBuilder text = new StringBuilder();
    if (dropped > 0) {
      text.append("... ").append(dropped).append(" earlier lines omitted\n");
    }
    text.append(String.join("\n", lines));
    return text.toString();
  }
}
