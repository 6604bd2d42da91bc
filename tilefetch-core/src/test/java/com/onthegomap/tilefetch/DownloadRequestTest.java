package com.onthegomap.tilefetch;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DownloadRequestTest {

  private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000);

  @ParameterizedTest
  @CsvSource({
    "12.9716, 77.5946, 0.005, 10, 16",
    "-85, -179.99, 0.001, 1, 1",
    "84.95, 179.85, 0.1, 21, 21",
    "0, 0, 0.05, 1, 21",
  })
  void testValid(double lat, double lon, double buffer, int minZoom, int maxZoom) {
    var request = new DownloadRequest(lat, lon, buffer, minZoom, maxZoom);
    assertEquals(lat, request.lat());
    assertNull(request.outputName());
  }

  @ParameterizedTest
  @CsvSource({
    "90, 0",
    "-90, 0",
    "91, 0",
    "0, 180",
    "0, -180",
    "0, 181",
    "NaN, 0",
    "0, NaN",
  })
  void testRejectsCoordinates(double lat, double lon) {
    assertThrows(IllegalArgumentException.class, () -> new DownloadRequest(lat, lon, 0.005, 10, 11));
  }

  @ParameterizedTest
  @CsvSource({
    "89.95, 0, 0.1",
    "-89.95, 0, 0.1",
    "85, 0, 0.06",
    "0, 179.95, 0.1",
    "0, -179.95, 0.1",
    "12.97, 179.999, 0.005",
  })
  void testRejectsAreaPastEdgeOfMap(double lat, double lon, double buffer) {
    var error = assertThrows(IllegalArgumentException.class, () -> new DownloadRequest(lat, lon, buffer, 10, 10, "x"));
    assertTrue(error.getMessage().contains("edge of the map"), error.getMessage());
  }

  @ParameterizedTest
  @CsvSource({
    "0, 5",
    "5, 22",
    "12, 11",
    "-1, 3",
  })
  void testRejectsZooms(int minZoom, int maxZoom) {
    assertThrows(IllegalArgumentException.class, () -> new DownloadRequest(12.97, 77.59, 0.005, minZoom, maxZoom));
  }

  @ParameterizedTest
  @CsvSource({
    "0.0009",
    "0.1001",
    "0",
    "-0.005",
    "NaN",
  })
  void testRejectsBuffer(double buffer) {
    assertThrows(IllegalArgumentException.class, () -> new DownloadRequest(12.97, 77.59, buffer, 10, 11));
  }

  @Test
  void testBounds() {
    var bounds = new DownloadRequest(12.9716, 77.5946, 0.005, 10, 11).bounds();
    assertEquals(12.9666, bounds.minLat(), 1e-9);
    assertEquals(77.5996, bounds.maxLon(), 1e-9);
  }

  @ParameterizedTest
  @CsvSource(value = {
    "city, city",
    "my city, my_city",
    "../../etc/passwd, etc_passwd",
    "a  b//c, a_b_c",
    "__x__, x",
    "with-dash_and_underscore, with-dash_and_underscore",
    "Bengaluru (2024), Bengaluru_2024",
  })
  void testSanitizedName(String input, String expected) {
    var request = new DownloadRequest(12.97, 77.59, 0.005, 10, 11, input);
    assertEquals(Optional.of(expected), request.sanitizedName());
    assertEquals(expected + ".mbtiles", request.fileName(NOW));
  }

  @Test
  void testNameWithNoSafeCharactersFallsBackToGenerated() {
    var request = new DownloadRequest(12.97, 77.59, 0.005, 10, 11, "../..");
    assertEquals(Optional.empty(), request.sanitizedName());
    assertEquals("output_1700000000.mbtiles", request.fileName(NOW));
    assertEquals("../...mbtiles", request.displayName(request.fileName(NOW)));
  }

  @Test
  void testBlankNameIsGenerated() {
    var request = new DownloadRequest(12.97, 77.59, 0.005, 10, 11, "  ");
    assertNull(request.outputName());
    assertEquals("output_1700000000.mbtiles", request.fileName(NOW));
    assertEquals("output_1700000000.mbtiles", request.displayName(request.fileName(NOW)));
  }

  @Test
  void testDisplayNameUsesRequestedName() {
    var request = new DownloadRequest(12.97, 77.59, 0.005, 10, 11, " my city ");
    assertEquals("my_city.mbtiles", request.fileName(NOW));
    assertEquals("my city.mbtiles", request.displayName(request.fileName(NOW)));
  }
}
