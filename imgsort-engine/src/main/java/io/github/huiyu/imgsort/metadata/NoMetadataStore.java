package io.github.huiyu.imgsort.metadata;

import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "imgsort", name = "metadata.mode", havingValue = "none", matchIfMissing = true)
public class NoMetadataStore implements MetadataStore {

    @Override
    public ImageMetadata get(ImageIdentity identity) {
        return null;
    }

    @Override
    public void save(ImageIdentity identity, ImageMetadata metadata) {
    }

    @Override
    public void delete(ImageIdentity identity) {
    }
}
