package com.example.helpdesk.qabot.cache;

import com.example.helpdesk.qabot.model.ResourceKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A single lazily loaded slot of the {@link ResourceCache}.
 *
 * <p>The value is either absent, or present with a last access no older than the TTL at the
 * moment it is read. The check-evict-load-store sequence runs under the slot lock, so
 * concurrent misses load once and a value is never evicted while another caller stores it.
 */
@Slf4j
public class CachedResource<T> {

    private final ResourceKind kind;
    private final Supplier<? extends T> loader;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private T value;
    private Instant lastAccess;
    private boolean permanentlyUnavailable;

    public CachedResource(ResourceKind kind, Supplier<? extends T> loader, Duration ttl, Clock clock) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<T> get() {
        lock.lock();
        try {
            evictIfExpired(clock.instant());
            if (value != null) {
                lastAccess = clock.instant();
                return Optional.of(value);
            }
            if (permanentlyUnavailable) {
                return Optional.empty();
            }
            return load();
        } finally {
            lock.unlock();
        }
    }

    /** Whether a value is held right now. Neither loads nor refreshes the access time. */
    public boolean isLoaded() {
        lock.lock();
        try {
            return value != null;
        } finally {
            lock.unlock();
        }
    }

    /** Like {@link #isLoaded()}, but the held value must also satisfy {@code condition}. */
    public boolean isLoaded(Predicate<? super T> condition) {
        lock.lock();
        try {
            return value != null && condition.test(value);
        } finally {
            lock.unlock();
        }
    }

    public void release() {
        lock.lock();
        try {
            if (value != null) {
                log.info("[resource-cache] Released {}", kind.label());
            }
            value = null;
            lastAccess = null;
        } finally {
            lock.unlock();
        }
    }

    public ResourceKind kind() {
        return kind;
    }

    private void evictIfExpired(Instant now) {
        if (value == null || lastAccess == null) {
            return;
        }
        if (Duration.between(lastAccess, now).compareTo(ttl) > 0) {
            log.info("[resource-cache] {} unused for more than {}s, evicting", kind.label(), ttl.toSeconds());
            value = null;
            lastAccess = null;
        }
    }

    private Optional<T> load() {
        T loaded;
        try {
            loaded = loader.get();
        } catch (ResourceLoadException e) {
            if (e.isPermanent()) {
                permanentlyUnavailable = true;
                log.warn("[resource-cache] {} is unavailable until restart: {}", kind.label(), e.getMessage());
            } else {
                log.warn("[resource-cache] Failed to load {}: {}", kind.label(), e.getMessage(), e);
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[resource-cache] Failed to load {}: {}", kind.label(), e.toString(), e);
            return Optional.empty();
        }

        if (loaded == null) {
            log.warn("[resource-cache] Loader for {} returned nothing", kind.label());
            return Optional.empty();
        }
        value = loaded;
        lastAccess = clock.instant();
        log.info("[resource-cache] Loaded {}", kind.label());
        return Optional.of(loaded);
    }
}
