package io.opendate.util;

import static org.junit.jupiter.api.Assertions.*;

import io.opendate.DateParseException;
import io.opendate.ErrorKind;
import io.opendate.Span;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

public class TzOffsetsTest {
  private static final Span SPAN = new Span(0, 6);

  @Test
  void testShapes() throws DateParseException {
    assertEquals(OptionalInt.of(19800), TzOffsets.parse('+', "05:30", SPAN, "+05:30"));
    assertEquals(OptionalInt.of(-10800), TzOffsets.parse('-', "0300", SPAN, "-0300"));
    assertEquals(OptionalInt.of(18000), TzOffsets.parse('+', "05", SPAN, "+05"));
    assertEquals(OptionalInt.of(0), TzOffsets.parse('-', "00:00", SPAN, "-00:00"));
  }

  @Test
  void testUnknownShapes() throws DateParseException {
    assertTrue(TzOffsets.parse('+', "5", SPAN, "+5").isEmpty());
    assertTrue(TzOffsets.parse('+', "053", SPAN, "+053").isEmpty());
    assertTrue(TzOffsets.parse('+', "05-30", SPAN, "+05-30").isEmpty());
    assertTrue(TzOffsets.parse('x', "0530", SPAN, "x0530").isEmpty());
  }

  @Test
  void testOutOfRange() {
    DateParseException hours =
        assertThrows(DateParseException.class, () -> TzOffsets.parse('+', "24", SPAN, "+24"));
    assertEquals(ErrorKind.AMBIGUOUS_OR_INVALID_NUMERIC, hours.kind());
    assertThrows(DateParseException.class, () -> TzOffsets.parse('-', "0560", SPAN, "-0560"));
  }

  @Test
  void testToSeconds() throws DateParseException {
    assertEquals(-34200, TzOffsets.toSeconds(-1, 9, 30, SPAN, "-09:30"));
  }
}
