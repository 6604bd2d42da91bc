package com.onthegomap.tilefetch.archive;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_ABSENT;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.onthegomap.tilefetch.util.Format;
import java.io.IOException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Container for everything related to serialization of {@link TileArchiveMetadata} into mbtiles metadata rows.
 */
public final class TileArchiveMetadataDeSer {

  private TileArchiveMetadataDeSer() {}

  private static final JsonMapper mbtilesMapper = newBaseBuilder().build();

  public static JsonMapper mbtilesMapper() {
    return mbtilesMapper;
  }

  public static JsonMapper.Builder newBaseBuilder() {
    return JsonMapper.builder()
      .addModule(new Jdk8Module())
      .serializationInclusion(NON_ABSENT);
  }

  /** Writes an envelope as {@code "minLon,minLat,maxLon,maxLat"}. */
  static class EnvelopeSerializer extends JsonSerializer<Envelope> {

    @Override
    public void serialize(Envelope v, JsonGenerator gen, SerializerProvider provider) throws IOException {
      gen.writeString(Format.joinCoordinates(v.getMinX(), v.getMinY(), v.getMaxX(), v.getMaxY()));
    }
  }

  /** Writes a coordinate as {@code "lon,lat"} or {@code "lon,lat,zoom"} when it has a zoom. */
  static class CoordinateSerializer extends JsonSerializer<Coordinate> {

    @Override
    public void serialize(Coordinate v, JsonGenerator gen, SerializerProvider provider) throws IOException {
      if (Double.isNaN(v.getZ())) {
        gen.writeString(Format.joinCoordinates(v.getX(), v.getY()));
      } else {
        gen.writeString(Format.joinCoordinates(v.getX(), v.getY(), Math.ceil(v.getZ())));
      }
    }
  }
}
