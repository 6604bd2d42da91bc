package com.onthegomap.tilefetch.mbtiles;

import com.fasterxml.jackson.core.type.TypeReference;
import com.onthegomap.tilefetch.archive.Tile;
import com.onthegomap.tilefetch.archive.TileArchiveMetadata;
import com.onthegomap.tilefetch.archive.TileArchiveMetadataDeSer;
import com.onthegomap.tilefetch.config.Arguments;
import com.onthegomap.tilefetch.geo.TileCoord;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * Interface into an mbtiles sqlite file containing tiles and metadata about the tileset.
 * <p>
 * Tiles are addressed with XYZ rows in this API and stored with TMS rows in the {@code tiles} table.
 *
 * @see <a href="https://github.com/mapbox/mbtiles-spec/blob/master/1.3/spec.md">MBTiles Specification</a>
 */
public final class Mbtiles implements AutoCloseable {

  // https://www.sqlite.org/src/artifact?ci=trunk&filename=magic.txt
  private static final int MBTILES_APPLICATION_ID = 0x4d504258;

  private static final String TILES_TABLE = "tiles";
  private static final String TILES_COL_X = "tile_column";
  private static final String TILES_COL_Y = "tile_row";
  private static final String TILES_COL_Z = "zoom_level";
  private static final String TILES_COL_DATA = "tile_data";

  private static final String METADATA_TABLE = "metadata";
  private static final String METADATA_COL_NAME = "name";
  private static final String METADATA_COL_VALUE = "value";

  private static final Logger LOGGER = LoggerFactory.getLogger(Mbtiles.class);

  // load the sqlite driver
  static {
    try {
      Class.forName("org.sqlite.JDBC");
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("JDBC driver not found");
    }
  }

  private final Connection connection;
  private PreparedStatement getTileStatement = null;

  private Mbtiles(Connection connection) {
    this.connection = connection;
  }

  /** Returns a new mbtiles file that won't get written to disk. Useful for toy use-cases like unit tests. */
  public static Mbtiles newInMemoryDatabase() {
    SQLiteConfig config = new SQLiteConfig();
    config.setApplicationId(MBTILES_APPLICATION_ID);
    return new Mbtiles(newConnection("jdbc:sqlite::memory:", config, Arguments.of()));
  }

  /**
   * Returns a new connection to an mbtiles file for writing with extra sqlite pragma options set from
   * {@code options}.
   */
  public static Mbtiles newWriteToFileDatabase(Path path, Arguments options) {
    Objects.requireNonNull(path);
    SQLiteConfig sqliteConfig = new SQLiteConfig();
    sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
    sqliteConfig.setLockingMode(SQLiteConfig.LockingMode.EXCLUSIVE);
    sqliteConfig.setTempStore(SQLiteConfig.TempStore.MEMORY);
    sqliteConfig.setApplicationId(MBTILES_APPLICATION_ID);
    var connection = newConnection("jdbc:sqlite:" + path.toAbsolutePath(), sqliteConfig, options);
    return new Mbtiles(connection);
  }

  /** Returns a new connection to an mbtiles file optimized for reads. */
  public static Mbtiles newReadOnlyDatabase(Path path) {
    Objects.requireNonNull(path);
    SQLiteConfig config = new SQLiteConfig();
    config.setReadOnly(true);
    return new Mbtiles(newConnection("jdbc:sqlite:" + path.toAbsolutePath(), config, Arguments.of()));
  }

  private static Connection newConnection(String url, SQLiteConfig defaults, Arguments args) {
    try {
      args = args.silenced();
      var config = new SQLiteConfig(defaults.toProperties());
      for (var pragma : SQLiteConfig.Pragma.values()) {
        var value = args.getString(pragma.getPragmaName(), pragma.getPragmaName(), null);
        if (value != null) {
          LOGGER.info("Setting custom mbtiles sqlite pragma {}={}", pragma.getPragmaName(), value);
          config.setPragma(pragma, value);
        }
      }
      return DriverManager.getConnection(url, config.toProperties());
    } catch (SQLException throwables) {
      throw new IllegalArgumentException("Unable to open " + url, throwables);
    }
  }

  private Mbtiles execute(Collection<String> queries) {
    for (String query : queries) {
      try (var statement = connection.createStatement()) {
        LOGGER.debug("Execute mbtiles: {}", query);
        statement.execute(query);
      } catch (SQLException throwables) {
        throw new IllegalStateException("Error executing queries " + String.join(",", queries), throwables);
      }
    }
    return this;
  }

  private Mbtiles execute(String... queries) {
    return execute(Arrays.asList(queries));
  }

  /** Creates the {@code metadata} and {@code tiles} tables and the unique index on tile coordinates. */
  public Mbtiles createTables() {
    return execute(
      "CREATE TABLE %s (%s text, %s text);".formatted(METADATA_TABLE, METADATA_COL_NAME, METADATA_COL_VALUE),
      "CREATE TABLE %s (%s integer, %s integer, %s integer, %s blob);"
        .formatted(TILES_TABLE, TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_COL_DATA),
      "CREATE UNIQUE INDEX tile_index on %s (%s, %s, %s);"
        .formatted(TILES_TABLE, TILES_COL_Z, TILES_COL_X, TILES_COL_Y)
    );
  }

  /**
   * Returns a writer that upserts tiles in batches and only commits them to disk when {@link TileWriter#commit()} is
   * called.
   */
  public TileWriter newTileWriter() {
    return new TileWriter();
  }

  /** Returns the contents of the metadata table. */
  public Metadata metadataTable() {
    return new Metadata();
  }

  private PreparedStatement getTileStatement() {
    if (getTileStatement == null) {
      try {
        getTileStatement = connection.prepareStatement("""
          SELECT %s FROM %s
          WHERE %s=? AND %s=? AND %s=?
          """.formatted(TILES_COL_DATA, TILES_TABLE, TILES_COL_X, TILES_COL_Y, TILES_COL_Z));
      } catch (SQLException throwables) {
        throw new IllegalStateException(throwables);
      }
    }
    return getTileStatement;
  }

  /** Returns the data for the tile at XYZ coordinate {@code x, y, z} or null if missing. */
  public byte[] getTile(int x, int y, int z) {
    try {
      PreparedStatement stmt = getTileStatement();
      stmt.setInt(1, x);
      stmt.setInt(2, TileCoord.flipY(y, z));
      stmt.setInt(3, z);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? rs.getBytes(TILES_COL_DATA) : null;
      }
    } catch (SQLException throwables) {
      throw new IllegalStateException("Could not get tile", throwables);
    }
  }

  public byte[] getTile(TileCoord coord) {
    return getTile(coord.x(), coord.y(), coord.z());
  }

  /** Returns the XYZ coordinates of every tile in the archive, sorted by zoom, then x, then y. */
  public List<TileCoord> getAllTileCoords() {
    List<TileCoord> result = new ArrayList<>();
    try (
      Statement statement = connection.createStatement();
      ResultSet rs = statement.executeQuery(
        "select %s, %s, %s from %s".formatted(TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_TABLE))
    ) {
      while (rs.next()) {
        result.add(TileCoord.ofTms(rs.getInt(TILES_COL_X), rs.getInt(TILES_COL_Y), rs.getInt(TILES_COL_Z)));
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Could not read tile coordinates from mbtiles file", e);
    }
    result.sort(null);
    return result;
  }

  /** Returns the number of rows in the tiles table. */
  public long tileCount() {
    try (
      Statement statement = connection.createStatement();
      ResultSet rs = statement.executeQuery("select count(*) from " + TILES_TABLE)
    ) {
      return rs.next() ? rs.getLong(1) : 0;
    } catch (SQLException e) {
      throw new IllegalStateException("Could not count tiles", e);
    }
  }

  public Connection connection() {
    return connection;
  }

  @Override
  public void close() throws IOException {
    try {
      if (getTileStatement != null) {
        getTileStatement.close();
      }
      connection.close();
    } catch (SQLException throwables) {
      throw new IOException(throwables);
    }
  }

  /**
   * Queues up tile upserts into large batches and writes them inside a single transaction until
   * {@link #commit()}.
   * <p>
   * Writing the same coordinate twice replaces the earlier row.
   */
  public class TileWriter implements AutoCloseable {

    private static final int MAX_PARAMETERS_IN_PREPARED_STATEMENT = 999;
    private static final List<String> COLUMNS = List.of(TILES_COL_Z, TILES_COL_X, TILES_COL_Y, TILES_COL_DATA);
    private final List<Tile> batch;
    private final int batchLimit;
    private final PreparedStatement batchStatement;
    private long count = 0;
    private long committed = 0;

    private TileWriter() {
      batchLimit = MAX_PARAMETERS_IN_PREPARED_STATEMENT / COLUMNS.size();
      batch = new ArrayList<>(batchLimit);
      try {
        connection.setAutoCommit(false);
      } catch (SQLException throwables) {
        throw new IllegalStateException("Could not start transaction", throwables);
      }
      batchStatement = createBatchInsertPreparedStatement(batchLimit);
    }

    private PreparedStatement createBatchInsertPreparedStatement(int size) {
      final String sql = "INSERT OR REPLACE INTO %s (%s) VALUES %s;".formatted(
        TILES_TABLE,
        String.join(",", COLUMNS),
        IntStream.range(0, size)
          .mapToObj(i -> COLUMNS.stream().map(c -> "?").collect(Collectors.joining(",", "(", ")")))
          .collect(Collectors.joining(", "))
      );
      try {
        return connection.prepareStatement(sql);
      } catch (SQLException throwables) {
        throw new IllegalStateException("Could not create prepared statement", throwables);
      }
    }

    /** Queue-up a write or flush to the database if enough are waiting. */
    public void write(Tile tile) {
      count++;
      batch.add(tile);
      if (batch.size() >= batchLimit) {
        flush(batchStatement);
      }
    }

    private void flush(PreparedStatement statement) {
      try {
        int pos = 1;
        for (Tile tile : batch) {
          TileCoord coord = tile.coord();
          statement.setInt(pos++, coord.z());
          statement.setInt(pos++, coord.x());
          // flip Y
          statement.setInt(pos++, coord.tmsY());
          statement.setBytes(pos++, tile.bytes());
        }
        statement.execute();
        batch.clear();
      } catch (SQLException throwables) {
        throw new IllegalStateException("Error flushing batch", throwables);
      }
    }

    private void flushRemaining() {
      if (!batch.isEmpty()) {
        try (var lastBatch = createBatchInsertPreparedStatement(batch.size())) {
          flush(lastBatch);
        } catch (SQLException throwables) {
          throw new IllegalStateException("Error flushing batch", throwables);
        }
      }
    }

    /** Writes every queued tile and commits the transaction. */
    public void commit() {
      flushRemaining();
      try {
        connection.commit();
      } catch (SQLException throwables) {
        throw new IllegalStateException("Error committing tiles", throwables);
      }
      LOGGER.debug("Committed {} tiles", count - committed);
      committed = count;
    }

    /** Number of tiles passed to {@link #write(Tile)} so far. */
    public long count() {
      return count;
    }

    @Override
    public void close() {
      commit();
      try {
        batchStatement.close();
        connection.setAutoCommit(true);
      } catch (SQLException throwables) {
        LOGGER.warn("Error closing prepared statement", throwables);
      }
    }
  }

  /** Data contained in the metadata table. */
  public class Metadata {

    /** Inserts a row into the metadata table that sets {@code name=value}. */
    public Metadata setMetadata(String name, String value) {
      if (value != null) {
        LOGGER.debug("Set mbtiles metadata: {}={}", name, value);
        try (
          PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO " + METADATA_TABLE + " (" + METADATA_COL_NAME + "," + METADATA_COL_VALUE + ") VALUES(?, ?);")
        ) {
          statement.setString(1, name);
          statement.setString(2, value);
          statement.execute();
        } catch (SQLException throwables) {
          throw new IllegalStateException("Error setting metadata " + name + "=" + value, throwables);
        }
      }
      return this;
    }

    /** Returns all key-value pairs from the metadata table in insertion order. */
    public Map<String, String> getAll() {
      Map<String, String> result = new LinkedHashMap<>();
      try (
        Statement statement = connection.createStatement();
        ResultSet resultSet = statement.executeQuery(
          "SELECT " + METADATA_COL_NAME + ", " + METADATA_COL_VALUE + " FROM " + METADATA_TABLE + " ORDER BY rowid")
      ) {
        while (resultSet.next()) {
          result.put(
            resultSet.getString(METADATA_COL_NAME),
            resultSet.getString(METADATA_COL_VALUE)
          );
        }
      } catch (SQLException throwables) {
        throw new IllegalStateException("Error retrieving metadata", throwables);
      }
      return result;
    }

    /**
     * Inserts one row into the metadata table for each of the well-known keys in {@code tileArchiveMetadata}.
     *
     * @see <a href="https://github.com/mapbox/mbtiles-spec/blob/master/1.3/spec.md#content">MBTiles 1.3
     *      specification</a>
     */
    public Metadata set(TileArchiveMetadata tileArchiveMetadata) {
      TileArchiveMetadataDeSer.mbtilesMapper()
        .convertValue(tileArchiveMetadata, new TypeReference<LinkedHashMap<String, String>>() {})
        .forEach(this::setMetadata);
      return this;
    }
  }
}
