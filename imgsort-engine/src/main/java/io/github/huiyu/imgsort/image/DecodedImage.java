package io.github.huiyu.imgsort.image;

/**
 * Decoded content of an image plus the metadata read along with it. The content is opaque
 * to the engine; only its byte cost is used for cache accounting.
 */
public final class DecodedImage {

    private final Object content;
    private final long cost;
    private final ImageMetadata metadata;

    public DecodedImage(Object content, long cost, ImageMetadata metadata) {
        this.content = content;
        this.cost = cost;
        this.metadata = metadata;
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
}
