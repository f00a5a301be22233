package io.github.huiyu.imgsort.metadata;

import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;

/**
 * Durable accelerator for image metadata. Never a source of truth: a record is only
 * returned while it still matches the file on disk.
 */
public interface MetadataStore {

    /**
     * @return the stored metadata, or null when absent or stale
     */
    ImageMetadata get(ImageIdentity identity);

    void save(ImageIdentity identity, ImageMetadata metadata);

    void delete(ImageIdentity identity);
}
