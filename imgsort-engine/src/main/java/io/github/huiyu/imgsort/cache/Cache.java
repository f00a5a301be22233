package io.github.huiyu.imgsort.cache;

import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.image.DecodedImage;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;
import io.github.huiyu.imgsort.index.Focus;

public interface Cache {

    enum Admission {
        ADMITTED,
        /**
         * Does not fit the budget even after eviction.
         */
        REJECTED_CAPACITY,
        /**
         * The identity has left the index.
         */
        REJECTED_ABSENT
    }

    /**
     * @return the entry, or null on a miss
     */
    CacheEntry get(ImageIdentity identity);

    /**
     * Like {@link #get} but leaves the access time alone.
     */
    CacheEntry peek(ImageIdentity identity);

    Admission put(ImageIdentity identity, DecodedImage image);

    /**
     * Remember that an image could not be decoded.
     */
    Admission putError(ImageIdentity identity, ErrorKind kind);

    boolean contains(ImageIdentity identity);

    /**
     * Idempotent. Drops content and metadata.
     */
    void invalidate(ImageIdentity identity);

    void invalidateAll();

    ImageMetadata getMetadata(ImageIdentity identity);

    void putMetadata(ImageIdentity identity, ImageMetadata metadata);

    /**
     * Publish the latest index snapshot, used for pinning, tie breaking and membership.
     */
    void focus(Focus focus);

    int size();

    long weight();
}
