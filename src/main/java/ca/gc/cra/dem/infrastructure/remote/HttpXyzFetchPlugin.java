package ca.gc.cra.dem.infrastructure.remote;

import ca.gc.cra.dem.application.port.RemoteFetchPlugin;
import ca.gc.cra.dem.domain.catalog.SourceUnavailableException;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.RegionFormat;
import ca.gc.cra.dem.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fetches plain-text {@code x y z} records over HTTPS.
 * <p><strong>How:</strong> The {@code url} argument may contain {@code {region}} ({@code w/e/s/n}) or
 * {@code {bbox}} ({@code w,s,e,n}) placeholders, filled from the padded query region. The response body is
 * streamed; records outside the query region and unparsable lines are dropped.</p>
 * <p><strong>Thread-safety:</strong> Shares one {@link HttpClient}; each returned stream is
 * single-threaded.</p>
 *
 * @since 0.1.0
 */
public class HttpXyzFetchPlugin implements RemoteFetchPlugin {
  private static final Logger log = LoggerFactory.getLogger(HttpXyzFetchPlugin.class);
  private static final Pattern SEPARATOR = Pattern.compile("[\\s,]+");
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(5);

  private final String scheme;
  private final HttpClient http;

  public HttpXyzFetchPlugin() {
    this("https");
  }

  protected HttpXyzFetchPlugin(String scheme) {
    this(scheme, HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  HttpXyzFetchPlugin(String scheme, HttpClient http) {
    this.scheme = Objects.requireNonNull(scheme, "scheme");
    this.http = Objects.requireNonNull(http, "http");
  }

  @Override
  public String scheme() {
    return scheme;
  }

  @Override
  public PointStream fetch(Region region, Map<String, String> args) throws IOException {
    URI uri = requestUri(args.get("url"), region);
    if (!scheme.equals(uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT))) {
      throw new IOException("plugin for '" + scheme + "' cannot fetch " + Logs.sanitize(uri.toString(), 200));
    }
    HttpRequest request = HttpRequest.newBuilder(uri)
        .header("Accept", "text/plain")
        .timeout(REQUEST_TIMEOUT)
        .GET()
        .build();
    HttpResponse<InputStream> response;
    try {
      response = http.send(request, HttpResponse.BodyHandlers.ofInputStream());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      InterruptedIOException interrupted = new InterruptedIOException("interrupted fetching " + uri);
      interrupted.initCause(ex);
      throw interrupted;
    }
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      response.body().close();
      throw new IOException("HTTP " + status + " from " + Logs.sanitize(uri.toString(), 200));
    }
    log.debug("Streaming xyz records from {}", uri);
    BufferedReader reader = new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8));
    XyzLines lines = new XyzLines(reader, uri);
    PointStream stream = PointStream.fromIterator(lines, lines::close);
    return region == null ? stream : stream.filter(p -> region.contains(p.x(), p.y()));
  }

  static URI requestUri(String url, Region region) throws IOException {
    if (url == null || url.isBlank()) {
      throw new IOException("remote entry has no url");
    }
    String filled = url.trim();
    if (region != null) {
      filled = filled
          .replace("{region}", region.format(RegionFormat.STR))
          .replace("{bbox}", region.format(RegionFormat.BBOX));
    }
    try {
      return URI.create(filled);
    } catch (IllegalArgumentException ex) {
      throw new IOException("invalid url " + Logs.sanitize(filled, 200), ex);
    }
  }

  /** Parses one line; {@code null} when it holds no record. */
  static PointRecord parse(String line) {
    String trimmed = line.strip();
    if (trimmed.isEmpty() || trimmed.startsWith("#")) {
      return null;
    }
    String[] parts = SEPARATOR.split(trimmed);
    if (parts.length < 3) {
      return null;
    }
    try {
      double x = Double.parseDouble(parts[0]);
      double y = Double.parseDouble(parts[1]);
      double z = Double.parseDouble(parts[2]);
      if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
        return null;
      }
      return PointRecord.of(x, y, z);
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static final class XyzLines implements Iterator<PointRecord> {
    private final BufferedReader reader;
    private final URI source;
    private PointRecord pending;
    private boolean done;

    XyzLines(BufferedReader reader, URI source) {
      this.reader = reader;
      this.source = source;
    }

    @Override
    public boolean hasNext() {
      while (pending == null && !done) {
        String line;
        try {
          line = reader.readLine();
        } catch (IOException ex) {
          close();
          throw new SourceUnavailableException(source.toString(), "read failed from " + source, ex);
        }
        if (line == null) {
          close();
        } else {
          pending = parse(line);
          if (pending == null && log.isDebugEnabled()) {
            log.debug("Skipping line from {}: {}", source, Logs.sanitize(line, 120));
          }
        }
      }
      return pending != null;
    }

    @Override
    public PointRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      PointRecord out = pending;
      pending = null;
      return out;
    }

    void close() {
      if (done) {
        return;
      }
      done = true;
      try {
        reader.close();
      } catch (IOException ex) {
        log.warn("Failed to close response from {}", source, ex);
      }
    }
  }
}
