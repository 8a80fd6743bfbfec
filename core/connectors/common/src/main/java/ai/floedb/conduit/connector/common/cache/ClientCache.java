/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.conduit.connector.common.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Authenticated clients of a single connector instance.
 *
 * <p>Each entry remembers the fingerprint of the credentials it was created with; a lookup with a
 * different fingerprint replaces the entry. Creation runs inside the map's per-key compute, so
 * concurrent callers for the same key wait for one handshake and share its client. Nothing is
 * stored when creation fails. Removed {@link AutoCloseable} clients are closed on the removing
 * thread.
 */
public final class ClientCache {
  private static final Logger LOG = Logger.getLogger(ClientCache.class);

  /** Key component used for resource types that have a single implicit resource. */
  public static final String IMPLICIT = "<implicit>";

  private final String owner;
  private final Cache<ClientKey, Entry> cache;

  public ClientCache(String owner, long maxSize, Duration idleTimeout) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(idleTimeout)
            .executor(Runnable::run)
            .<ClientKey, Entry>removalListener(this::onRemoval)
            .build();
  }

  /** Cache key: resource type plus canonical resource id (or {@link #IMPLICIT}). */
  public record ClientKey(String resourceType, String resourceId) {
    public ClientKey {
      Objects.requireNonNull(resourceType, "resourceType");
      Objects.requireNonNull(resourceId, "resourceId");
    }

    public static ClientKey implicit(String resourceType) {
      return new ClientKey(resourceType, IMPLICIT);
    }
  }

  private record Entry(Object client, String fingerprint) {}

  /**
   * Returns the client cached for {@code key} if it was created with {@code fingerprint}, otherwise
   * creates one with {@code factory}. A stale entry is evicted even when its replacement fails.
   */
  public Object get(ClientKey key, String fingerprint, Supplier<?> factory) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(fingerprint, "fingerprint");
    RuntimeException[] failure = new RuntimeException[1];
    Entry entry =
        cache
            .asMap()
            .compute(
                key,
                (k, existing) -> {
                  if (existing != null && existing.fingerprint().equals(fingerprint)) {
                    LOG.debugf("Client cache hit owner=%s key=%s", owner, k);
                    return existing;
                  }
                  if (existing != null) {
                    LOG.infof(
                        "Credentials changed, replacing cached client owner=%s key=%s", owner, k);
                  }
                  try {
                    Object client =
                        Objects.requireNonNull(factory.get(), "connector returned a null client");
                    LOG.debugf("Cached new client owner=%s key=%s", owner, k);
                    return new Entry(client, fingerprint);
                  } catch (RuntimeException e) {
                    failure[0] = e;
                    return null;
                  }
                });
    if (failure[0] != null) {
      throw failure[0];
    }
    return entry.client();
  }

  /** Cached client for {@code key} regardless of fingerprint, or {@code null}. */
  public Object peek(ClientKey key) {
    Entry e = cache.getIfPresent(key);
    return e == null ? null : e.client();
  }

  public boolean containsFingerprint(String fingerprint) {
    return cache.asMap().values().stream().anyMatch(e -> e.fingerprint().equals(fingerprint));
  }

  public long size() {
    return cache.asMap().size();
  }

  public void invalidate(ClientKey key) {
    cache.invalidate(key);
  }

  /** Removes and closes every entry; returns once all clients are closed. */
  public void invalidateAll() {
    cache.invalidateAll();
    cache.cleanUp();
  }

  private void onRemoval(ClientKey key, Entry entry, RemovalCause cause) {
    if (entry == null) {
      return;
    }
    if (cause == RemovalCause.REPLACED && cache.asMap().get(key) == entry) {
      // compute kept the live entry
      return;
    }
    LOG.debugf("Closing client owner=%s key=%s cause=%s", owner, key, cause);
    if (entry.client() instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        LOG.warnf(e, "Failed to close client owner=%s key=%s", owner, key);
      }
    }
  }
}
