package com.mk.fx.qa.stress.execution.utils;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class StressUtils {

  private static final long KIB = 1024L;
  private static final long MIB = KIB * 1024;
  private static final long GIB = MIB * 1024;
  private static final long TIB = GIB * 1024;

  private static final Pattern BYTE_SIZE = Pattern.compile("(\\d+)\\s*([KMGT]?)B?");

  private StressUtils() {
    // Utility class, no instantiation
  }

  /**
   * Parses a byte quantity such as {@code 512M}, {@code 1G}, {@code 64kb} or {@code 4096}.
   * Units are binary (K = 1024) and case-insensitive.
   *
   * @throws IllegalArgumentException if the value is blank, malformed, zero or overflows
   */
  public static long parseByteSize(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Memory size must not be blank");
    }
    Matcher matcher = BYTE_SIZE.matcher(value.trim().toUpperCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Unrecognised memory size: " + value);
    }
    long multiplier =
        switch (matcher.group(2)) {
          case "K" -> KIB;
          case "M" -> MIB;
          case "G" -> GIB;
          case "T" -> TIB;
          default -> 1L;
        };
    long amount;
    try {
      amount = Long.parseLong(matcher.group(1));
      amount = Math.multiplyExact(amount, multiplier);
    } catch (NumberFormatException | ArithmeticException ex) {
      throw new IllegalArgumentException("Memory size too large: " + value);
    }
    if (amount <= 0) {
      throw new IllegalArgumentException("Memory size must be positive: " + value);
    }
    return amount;
  }

  /** Renders bytes using the largest unit that divides them exactly, e.g. {@code 512M}. */
  public static String formatByteSize(long bytes) {
    if (bytes >= GIB && bytes % GIB == 0) {
      return bytes / GIB + "G";
    }
    if (bytes >= MIB && bytes % MIB == 0) {
      return bytes / MIB + "M";
    }
    if (bytes >= KIB && bytes % KIB == 0) {
      return bytes / KIB + "K";
    }
    return Long.toString(bytes);
  }

  /** Describes an exit status, decoding the 128+N convention of signal-terminated processes. */
  public static String describeExit(int exitCode) {
    if (exitCode > 128 && exitCode < 160) {
      return "terminated by signal " + (exitCode - 128);
    }
    return "exited with code " + exitCode;
  }
}
