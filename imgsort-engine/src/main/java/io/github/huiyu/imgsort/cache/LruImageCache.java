package io.github.huiyu.imgsort.cache;

import com.google.common.base.Ticker;
import com.google.common.cache.CacheBuilder;

import io.github.huiyu.imgsort.config.Configuration;
import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.image.DecodedImage;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;
import io.github.huiyu.imgsort.index.Focus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decoded images bounded by entry count and total byte cost. Evicts the least recently
 * used entry first; among equally old entries the one furthest from the cursor goes.
 * Entries within distance one of the cursor are never evicted.
 */
@Component
public class LruImageCache implements Cache {

    private static final Logger LOG = LoggerFactory.getLogger(LruImageCache.class);

    private final int maxCount;
    private final long maxBytes;
    private final Ticker ticker;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<ImageIdentity, CacheEntry> entries = new HashMap<>();
    private final com.google.common.cache.Cache<ImageIdentity, ImageMetadata> metadataCache;

    // guarded by lock
    private long bytes = 0L;
    // null until the first focus is published, everything is admitted until then
    private volatile Focus focus;

    @Autowired
    public LruImageCache(Configuration config) {
        this(config.getCacheMaxCount(), config.getCacheMaxBytes(), Ticker.systemTicker());
    }

    public LruImageCache(int maxCount, long maxBytes, Ticker ticker) {
        checkArgument(maxCount > 0, "maxCount must be positive");
        checkArgument(maxBytes > 0, "maxBytes must be positive");
        this.maxCount = maxCount;
        this.maxBytes = maxBytes;
        this.ticker = checkNotNull(ticker);
        this.metadataCache = CacheBuilder.newBuilder()
                .maximumSize(maxCount * 4L)
                .build();
    }

    @Override
    public CacheEntry get(ImageIdentity identity) {
        CacheEntry entry;
        final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            entry = entries.get(identity);
            if (entry != null) {
                entry.touch(ticker.read());
            }
        } finally {
            readLock.unlock();
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("Cache {} {}", entry == null ? "miss" : "hit", identity);
        }
        return entry;
    }

    @Override
    public CacheEntry peek(ImageIdentity identity) {
        final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return entries.get(identity);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Admission put(ImageIdentity identity, DecodedImage image) {
        Admission admission = admit(identity, image.getContent(), image.getCost(),
                image.getMetadata(), CacheEntry.Status.READY, null);
        if (image.getMetadata() != null && admission != Admission.REJECTED_ABSENT) {
            metadataCache.put(identity, image.getMetadata());
        }
        return admission;
    }

    @Override
    public Admission putError(ImageIdentity identity, ErrorKind kind) {
        return admit(identity, null, 0L, null, CacheEntry.Status.ERROR, checkNotNull(kind));
    }

    private Admission admit(ImageIdentity identity, Object content, long cost,
                            ImageMetadata metadata, CacheEntry.Status status, ErrorKind error) {
        checkNotNull(identity);
        checkArgument(cost >= 0, "cost must not be negative");
        final ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Focus focus = this.focus;
            if (focus != null && !focus.contains(identity)) {
                LOG.debug("Rejected {}, no longer indexed", identity);
                return Admission.REJECTED_ABSENT;
            }
            if (cost > maxBytes) {
                LOG.info("Rejected {}, cost {} exceeds cache budget {}", identity, cost, maxBytes);
                return Admission.REJECTED_CAPACITY;
            }
            // plan the evictions first, a rejection leaves the cache as it was
            CacheEntry previous = entries.get(identity);
            int count = entries.size() - (previous == null ? 0 : 1);
            long used = bytes - (previous == null ? 0L : previous.getCost());
            List<CacheEntry> victims = new ArrayList<>();
            Iterator<CacheEntry> candidates = evictionOrder(identity, focus).iterator();
            while (count + 1 > maxCount || used + cost > maxBytes) {
                if (!candidates.hasNext()) {
                    LOG.info("Rejected {}, only pinned entries left to evict", identity);
                    return Admission.REJECTED_CAPACITY;
                }
                CacheEntry victim = candidates.next();
                victims.add(victim);
                count--;
                used -= victim.getCost();
            }
            for (CacheEntry victim : victims) {
                entries.remove(victim.getIdentity());
                LOG.debug("Evicted {}", victim);
            }
            entries.put(identity, new CacheEntry(identity, content, cost, metadata, status, error,
                    ticker.read()));
            bytes = used + cost;
            return Admission.ADMITTED;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Evictable entries other than {@code identity}, least recently used first, ties broken
     * by the larger distance from the cursor.
     */
    private List<CacheEntry> evictionOrder(ImageIdentity identity, Focus focus) {
        Map<ImageIdentity, Integer> distances = new HashMap<>();
        List<CacheEntry> order = new ArrayList<>();
        for (CacheEntry candidate : entries.values()) {
            if (candidate.getIdentity().equals(identity)) {
                continue;
            }
            int distance = focus == null ? Integer.MAX_VALUE : focus.distance(candidate.getIdentity());
            if (distance <= 1) {
                continue; // pinned
            }
            distances.put(candidate.getIdentity(), distance);
            order.add(candidate);
        }
        order.sort(Comparator.comparingLong(CacheEntry::getLastAccess)
                .thenComparing(e -> distances.get(e.getIdentity()), Comparator.reverseOrder()));
        return order;
    }

    @Override
    public boolean contains(ImageIdentity identity) {
        final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return entries.containsKey(identity);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void invalidate(ImageIdentity identity) {
        final ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            CacheEntry removed = entries.remove(identity);
            if (removed != null) {
                bytes -= removed.getCost();
                LOG.debug("Invalidated {}", removed);
            }
        } finally {
            writeLock.unlock();
        }
        metadataCache.invalidate(identity);
    }

    @Override
    public void invalidateAll() {
        final ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            entries.clear();
            bytes = 0L;
        } finally {
            writeLock.unlock();
        }
        metadataCache.invalidateAll();
    }

    @Override
    public ImageMetadata getMetadata(ImageIdentity identity) {
        return metadataCache.getIfPresent(identity);
    }

    @Override
    public void putMetadata(ImageIdentity identity, ImageMetadata metadata) {
        Focus focus = this.focus;
        if (focus != null && !focus.contains(identity)) {
            return;
        }
        metadataCache.put(identity, checkNotNull(metadata));
    }

    @Override
    public void focus(Focus focus) {
        final ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            checkNotNull(focus);
            // a late publisher must not roll back a newer snapshot
            if (this.focus == null || focus.getVersion() >= this.focus.getVersion()) {
                this.focus = focus;
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int size() {
        final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return entries.size();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public long weight() {
        final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return bytes;
        } finally {
            readLock.unlock();
        }
    }
}
