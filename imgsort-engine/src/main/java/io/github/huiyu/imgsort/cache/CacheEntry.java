package io.github.huiyu.imgsort.cache;

import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.image.DecodedImage;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;

/**
 * One cached image. Owned by the {@link Cache}; everyone else only reads it.
 */
public final class CacheEntry {

    public enum Status {
        PENDING, READY, ERROR
    }

    private final ImageIdentity identity;
    private final Object content;
    private final long cost;
    private final ImageMetadata metadata;
    private final Status status;
    private final ErrorKind error;
    private final boolean cached;

    private volatile long lastAccess;

    CacheEntry(ImageIdentity identity, Object content, long cost, ImageMetadata metadata,
               Status status, ErrorKind error, long lastAccess) {
        this(identity, content, cost, metadata, status, error, lastAccess, true);
    }

    private CacheEntry(ImageIdentity identity, Object content, long cost, ImageMetadata metadata,
                       Status status, ErrorKind error, long lastAccess, boolean cached) {
        this.identity = identity;
        this.content = content;
        this.cost = cost;
        this.metadata = metadata;
        this.status = status;
        this.error = error;
        this.lastAccess = lastAccess;
        this.cached = cached;
    }

    /**
     * Placeholder describing a load that is still running. Never stored.
     */
    public static CacheEntry pending(ImageIdentity identity) {
        return new CacheEntry(identity, null, 0L, null, Status.PENDING, null, 0L, false);
    }

    /**
     * An entry handed out without being cached.
     */
    public static CacheEntry transientEntry(ImageIdentity identity, DecodedImage image) {
        return new CacheEntry(identity, image.getContent(), image.getCost(), image.getMetadata(),
                Status.READY, null, 0L, false);
    }

    /**
     * @return false for an entry served without being admitted to the cache
     */
    public boolean isCached() {
        return cached;
    }

    public ImageIdentity getIdentity() {
        return identity;
    }

    public Object getContent() {
        return content;
    }

    public long getCost() {
        return cost;
    }

    public ImageMetadata getMetadata() {
        return metadata;
    }

    public Status getStatus() {
        return status;
    }

    public ErrorKind getError() {
        return error;
    }

    public long getLastAccess() {
        return lastAccess;
    }

    void touch(long now) {
        this.lastAccess = now;
    }

    @Override
    public String toString() {
        return "CacheEntry{" +
                "identity=" + identity +
                ", status=" + status +
                (error != null ? ", error=" + error : "") +
                ", cost=" + cost +
                '}';
    }
}
