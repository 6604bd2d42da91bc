package com.onthegomap.tilefetch.fetch;

import static com.google.common.net.HttpHeaders.USER_AGENT;

import com.onthegomap.tilefetch.config.TileFetchConfig;
import com.onthegomap.tilefetch.geo.TileCoord;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requests individual tiles from a {@link TileSource} over HTTP, one at a time and with a fixed pause after each
 * request.
 * <p>
 * Failures are returned as {@link TileFetchResult} values and never retried.
 */
public class TileFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileFetcher.class);

  private final TileSource source;
  private final String userAgent;
  private final Duration timeout;
  private final Duration requestDelay;
  private final HttpClient client;

  TileFetcher(TileSource source, String userAgent, Duration timeout, Duration requestDelay) {
    this.source = source;
    this.userAgent = userAgent;
    this.timeout = timeout;
    this.requestDelay = requestDelay;
    this.client = HttpClient.newBuilder()
      .connectTimeout(timeout)
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build();
  }

  protected TileFetcher(TileFetchConfig config) {
    this(config.tileSource(), config.httpUserAgent(), config.httpTimeout(), config.requestDelay());
  }

  public static TileFetcher create(TileFetchConfig config) {
    return new TileFetcher(config);
  }

  public TileSource source() {
    return source;
  }

  /**
   * Requests the tile at {@code coord} and validates the response, then waits for the configured request delay.
   *
   * @return {@link TileFetchResult.Ok} with the tile bytes if the server responded with status 200 and an image
   *         payload, {@link TileFetchResult.Rejected} if it responded with anything else, or
   *         {@link TileFetchResult.TransportError} if no response arrived
   */
  public TileFetchResult fetch(TileCoord coord) {
    String url = source.url(coord);
    TileFetchResult result;
    try {
      result = validate(coord, httpGet(url));
    } catch (IOException e) {
      result = new TileFetchResult.TransportError(coord, e.toString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result = new TileFetchResult.TransportError(coord, "Interrupted requesting " + url);
    }
    if (!result.isOk()) {
      LOGGER.debug("Failed to download tile {}/{}/{}: {}", coord.z(), coord.x(), coord.y(), result);
    }
    pause();
    return result;
  }

  private TileFetchResult validate(TileCoord coord, TileResponse response) {
    if (response.status() != 200) {
      return new TileFetchResult.Rejected(coord, "Bad response: " + response.status());
    }
    byte[] body = response.body();
    if (body == null || body.length == 0) {
      return new TileFetchResult.Rejected(coord, "Empty response");
    }
    if (!source.hasValidSignature(body)) {
      return new TileFetchResult.Rejected(coord, "Response is not a png or jpeg image");
    }
    return new TileFetchResult.Ok(coord, body);
  }

  /** Issues a single GET request for {@code url}. */
  protected TileResponse httpGet(String url) throws IOException, InterruptedException {
    var request = HttpRequest.newBuilder(URI.create(url))
      .timeout(timeout)
      .header(USER_AGENT, userAgent)
      .GET()
      .build();
    HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    return new TileResponse(response.statusCode(), response.body());
  }

  private void pause() {
    try {
      sleep(requestDelay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Blocks for {@code duration} after each request. */
  protected void sleep(Duration duration) throws InterruptedException {
    if (!duration.isZero()) {
      Thread.sleep(duration.toMillis());
    }
  }

  /** Status code and body returned by the tile server. */
  public record TileResponse(int status, byte[] body) {}
}
