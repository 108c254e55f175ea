/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.datamat.adapter.api.http;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces a minimum interval between requests on one rate channel.
 *
 * <p>The interval is {@code 60 / requestsPerMinute} seconds. A limit that is
 * unset or not positive disables pacing. The check-and-update of the last
 * request time happens under a lock, so concurrent callers are admitted one
 * at a time and never burst past the limit.
 *
 * <p>An extraction uses two independent governors: one for the paginated
 * fetch and one for detail enrichment.
 */
public class RateGovernor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateGovernor.class);

  private final String channel;
  private final long periodNanos;
  private final ReentrantLock lock = new ReentrantLock();

  private long lastRequestNanos;
  private boolean hasRequested;

  private RateGovernor(String channel, long periodNanos) {
    this.channel = channel;
    this.periodNanos = periodNanos;
  }

  /**
   * Creates a governor allowing at most {@code requestsPerMinute} requests per
   * minute on the named channel.
   *
   * @param channel Channel name used in log messages
   * @param requestsPerMinute Limit; null or non-positive disables pacing
   */
  public static RateGovernor perMinute(String channel, @Nullable Integer requestsPerMinute) {
    if (requestsPerMinute == null || requestsPerMinute <= 0) {
      return new RateGovernor(channel, 0);
    }
    return new RateGovernor(channel, TimeUnit.MINUTES.toNanos(1) / requestsPerMinute);
  }

  /**
   * Creates a governor that never waits.
   */
  public static RateGovernor unlimited(String channel) {
    return new RateGovernor(channel, 0);
  }

  /**
   * Blocks until a request may be issued on this channel, then records it.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void await() throws InterruptedException {
    if (periodNanos == 0) {
      return;
    }
    lock.lockInterruptibly();
    try {
      if (hasRequested) {
        long waitNanos = periodNanos - (System.nanoTime() - lastRequestNanos);
        if (waitNanos > 0) {
          LOGGER.debug("Rate channel '{}' pacing for {}ms", channel,
              TimeUnit.NANOSECONDS.toMillis(waitNanos));
          TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
      }
      lastRequestNanos = System.nanoTime();
      hasRequested = true;
    } finally {
      lock.unlock();
    }
  }

  public String getChannel() {
    return channel;
  }

  /**
   * Returns the minimum spacing between requests; zero when pacing is off.
   */
  public Duration getPeriod() {
    return Duration.ofNanos(periodNanos);
  }

  public boolean isEnabled() {
    return periodNanos > 0;
  }

  @Override public String toString() {
    return "RateGovernor{channel='" + channel + "', period=" + getPeriod() + "}";
  }
}
