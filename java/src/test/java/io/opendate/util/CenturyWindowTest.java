package io.opendate.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Year;
import org.junit.jupiter.api.Test;

public class CenturyWindowTest {

  @Test
  void testWindowAroundReference() {
    assertEquals(1996, CenturyWindow.expand(96, 2026));
    assertEquals(2003, CenturyWindow.expand(3, 2026));
    assertEquals(2075, CenturyWindow.expand(75, 2026));
    assertEquals(1976, CenturyWindow.expand(76, 2026));
  }

  @Test
  void testWindowEdges() {
    assertEquals(2049, CenturyWindow.expand(49, 2000));
    assertEquals(1950, CenturyWindow.expand(50, 2000));
    assertEquals(2000, CenturyWindow.expand(0, 2000));
    assertEquals(2099, CenturyWindow.expand(99, 2099));
    assertEquals(2148, CenturyWindow.expand(48, 2099));
  }

  @Test
  void testCurrentYearStaysWithinFiftyYears() {
    int now = Year.now().getValue();
    for (int yy = 0; yy < 100; yy++) {
      int year = CenturyWindow.expand(yy);
      assertEquals(yy, Math.floorMod(year, 100));
      assertTrue(year >= now - 50 && year < now + 50, yy + " -> " + year);
    }
  }

  @Test
  void testRejectsNonTwoDigit() {
    assertThrows(IllegalArgumentException.class, () -> CenturyWindow.expand(100, 2026));
    assertThrows(IllegalArgumentException.class, () -> CenturyWindow.expand(-1, 2026));
  }
}
