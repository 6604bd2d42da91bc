package com.onthegomap.tilefetch.fetch;

import com.onthegomap.tilefetch.geo.TileCoord;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Describes the remote server tiles get downloaded from and how to recognize a valid tile payload.
 *
 * @param name        name written to the archive metadata
 * @param description description written to the archive metadata
 * @param urlTemplate url with {@code {z}}, {@code {x}} and {@code {y}} placeholders where {@code y} is the XYZ row
 * @param format      image format written to the archive metadata
 * @param attribution attribution written to the archive metadata
 * @param signatures  leading bytes a payload must start with to be accepted
 */
public record TileSource(
  String name,
  String description,
  String urlTemplate,
  String format,
  String attribution,
  List<byte[]> signatures
) {

  public static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G'};
  public static final byte[] JPEG_SIGNATURE = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};

  public static final TileSource ARCGIS_WORLD_IMAGERY = new TileSource(
    "Satellite Imagery",
    "Satellite imagery tiles",
    "https://services.arcgisonline.com/ArcGIS/rest/services/World_Imagery/MapServer/tile/{z}/{y}/{x}",
    "png",
    "Satellite imagery © ArcGIS World Imagery",
    List.of(PNG_SIGNATURE, JPEG_SIGNATURE)
  );

  public TileSource {
    Objects.requireNonNull(urlTemplate, "urlTemplate");
    if (!urlTemplate.contains("{z}") || !urlTemplate.contains("{x}") || !urlTemplate.contains("{y}")) {
      throw new IllegalArgumentException("Tile url must contain {z}, {x} and {y} placeholders: " + urlTemplate);
    }
    signatures = List.copyOf(signatures);
  }

  /** Returns a copy of this source that requests tiles from {@code newTemplate} instead. */
  public TileSource withUrlTemplate(String newTemplate) {
    return new TileSource(name, description, newTemplate, format, attribution, signatures);
  }

  public String url(TileCoord coord) {
    return urlTemplate
      .replace("{z}", Integer.toString(coord.z()))
      .replace("{y}", Integer.toString(coord.y()))
      .replace("{x}", Integer.toString(coord.x()));
  }

  /** Returns true if {@code data} starts with one of the accepted image signatures. */
  public boolean hasValidSignature(byte[] data) {
    for (byte[] signature : signatures) {
      if (data.length >= signature.length &&
        Arrays.equals(data, 0, signature.length, signature, 0, signature.length)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "TileSource[" + name + " " + urlTemplate + "]";
  }
}
