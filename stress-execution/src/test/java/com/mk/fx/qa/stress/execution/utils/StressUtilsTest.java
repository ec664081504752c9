package com.mk.fx.qa.stress.execution.utils;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StressUtilsTest {

  @Test
  void parseByteSize_acceptsUnitsCaseInsensitively() {
    assertEquals(512L * 1024 * 1024, StressUtils.parseByteSize("512M"));
    assertEquals(512L * 1024 * 1024, StressUtils.parseByteSize("512mb"));
    assertEquals(1024L * 1024 * 1024, StressUtils.parseByteSize("1G"));
    assertEquals(64L * 1024, StressUtils.parseByteSize(" 64k "));
    assertEquals(4096L, StressUtils.parseByteSize("4096"));
    assertEquals(100L, StressUtils.parseByteSize("100B"));
    assertEquals(2L * 1024 * 1024 * 1024 * 1024, StressUtils.parseByteSize("2T"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "M", "12X", "1.5G", "-5M", "0", "0M", "abc", "99999999999999999999G"})
  void parseByteSize_rejectsInvalidValues(String value) {
    assertThrows(IllegalArgumentException.class, () -> StressUtils.parseByteSize(value));
  }

  @Test
  void parseByteSize_rejectsNull() {
    assertThrows(IllegalArgumentException.class, () -> StressUtils.parseByteSize(null));
  }

  @Test
  void formatByteSize_usesLargestExactUnit() {
    assertEquals("512M", StressUtils.formatByteSize(512L * 1024 * 1024));
    assertEquals("1G", StressUtils.formatByteSize(1024L * 1024 * 1024));
    assertEquals("1536M", StressUtils.formatByteSize(1536L * 1024 * 1024));
    assertEquals("64K", StressUtils.formatByteSize(64L * 1024));
    assertEquals("1000", StressUtils.formatByteSize(1000L));
  }

  @Test
  void describeExit_decodesSignals() {
    assertEquals("exited with code 3", StressUtils.describeExit(3));
    assertEquals("terminated by signal 15", StressUtils.describeExit(143));
    assertEquals("terminated by signal 9", StressUtils.describeExit(137));
  }
}
