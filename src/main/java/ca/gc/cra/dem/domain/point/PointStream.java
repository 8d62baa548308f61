package ca.gc.cra.dem.domain.point;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Single-pass, pull-based sequence of {@link PointRecord}s backed by an open source.
 * <p><strong>Role:</strong> Currency between the catalog resolver, raster scans, remote fetch plugins, the
 * grid binner and interpolation engines.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; consume from one thread.</p>
 *
 * <p>A stream is not replayable. Call {@link #close()} to release the underlying source even when the
 * stream was not exhausted.</p>
 *
 * @since 0.1.0
 */
public interface PointStream extends Iterator<PointRecord>, AutoCloseable {

  /** Releases the underlying source. Idempotent. */
  @Override
  void close();

  /**
   * Returns an empty stream.
   *
   * @return exhausted stream
   */
  static PointStream empty() {
    return of(List.of());
  }

  /**
   * Wraps an in-memory list.
   *
   * @param records records to replay once
   * @return stream over {@code records}
   */
  static PointStream of(List<PointRecord> records) {
    Objects.requireNonNull(records, "records");
    return fromIterator(records.iterator(), () -> { });
  }

  /**
   * Adapts an iterator plus a close action.
   *
   * @param iterator record source
   * @param onClose action run once on close
   * @return stream view
   */
  static PointStream fromIterator(Iterator<PointRecord> iterator, Runnable onClose) {
    Objects.requireNonNull(iterator, "iterator");
    Objects.requireNonNull(onClose, "onClose");
    return new PointStream() {
      private boolean closed;

      @Override
      public boolean hasNext() {
        return !closed && iterator.hasNext();
      }

      @Override
      public PointRecord next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return iterator.next();
      }

      @Override
      public void close() {
        if (!closed) {
          closed = true;
          onClose.run();
        }
      }
    };
  }

  /**
   * Returns a stream yielding only records accepted by {@code filter}.
   *
   * @param filter record predicate
   * @return filtered view sharing this stream's source
   */
  default PointStream filter(Predicate<PointRecord> filter) {
    Objects.requireNonNull(filter, "filter");
    PointStream source = this;
    return new PointStream() {
      private PointRecord pending;

      @Override
      public boolean hasNext() {
        while (pending == null && source.hasNext()) {
          PointRecord candidate = source.next();
          if (filter.test(candidate)) {
            pending = candidate;
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

      @Override
      public void close() {
        source.close();
      }
    };
  }

  /**
   * Returns a stream transforming every record with {@code mapper}.
   *
   * @param mapper record transformation
   * @return mapped view sharing this stream's source
   */
  default PointStream map(UnaryOperator<PointRecord> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    PointStream source = this;
    return new PointStream() {
      @Override
      public boolean hasNext() {
        return source.hasNext();
      }

      @Override
      public PointRecord next() {
        return mapper.apply(source.next());
      }

      @Override
      public void close() {
        source.close();
      }
    };
  }
}
