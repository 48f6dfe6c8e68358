/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A time-bounded cache in front of a {@link RecordSource}. While the last fetched records are fresh, they are served
 * from the cache. Once they go stale, the next {@link #get()} fetches again; if that fetch fails, the stale records are
 * served instead, so that a transient outage does not blank out a display.
 *
 * <p>An empty fetch result is never served from the cache: the next {@code get()} fetches again.
 *
 * <p>Methods are synchronized, so one cache may be shared between threads. A fetch happens while holding the lock.
 */
public class RecordCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordCache.class);

    /** The default time that fetched records stay fresh. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final RecordSource source;
    private final Clock clock;
    private final Duration ttl;
    private RecordSet records = null;
    private Instant fetchedAt = null;

    /**
     * Creates a cache with the system clock and the {@link #DEFAULT_TTL default TTL}.
     *
     * @param source the record source
     */
    public RecordCache(RecordSource source) {
        this(source, Clock.systemUTC(), DEFAULT_TTL);
    }

    /**
     * Creates a cache.
     *
     * @param source the record source
     * @param clock the clock that decides freshness
     * @param ttl the time that fetched records stay fresh
     * @throws IllegalArgumentException if the TTL is negative
     */
    public RecordCache(RecordSource source, Clock clock, Duration ttl) {
        this.source = Objects.requireNonNull(source);
        this.clock = Objects.requireNonNull(clock);
        this.ttl = Objects.requireNonNull(ttl);
        if (ttl.isNegative())
            throw new IllegalArgumentException("TTL must not be negative: " + ttl);
    }

    /**
     * Returns the cached records if they are fresh, or else fetches the records from the source.
     *
     * @return the records
     * @throws IOException if fetching fails and there are no stale records to fall back on
     */
    public synchronized RecordSet get() throws IOException {
        if (isFresh())
            return records;
        RecordSet fetched;
        try {
            fetched = Objects.requireNonNull(source.fetch(), "source returned null");
        } catch (IOException e) {
            if (records == null)
                throw e;
            LOGGER.warn("Failed to fetch records; serving {} stale records fetched at {}",
                        records.size(), fetchedAt, e);
            return records;
        }
        LOGGER.info("Fetched {} records", fetched.size());
        records = fetched;
        fetchedAt = clock.instant();
        return fetched;
    }

    /**
     * Returns {@code true} if a {@link #get()} would be served from the cache without fetching.
     *
     * @return {@code true} if the cached records are fresh
     */
    public synchronized boolean isFresh() {
        return records != null
            && !records.isEmpty()
            && clock.instant().isBefore(fetchedAt.plus(ttl));
    }

    /**
     * Marks the cached records stale, so that the next {@link #get()} fetches. The records remain available as a
     * fallback if that fetch fails.
     */
    public synchronized void invalidate() {
        fetchedAt = Instant.MIN;
    }
}
