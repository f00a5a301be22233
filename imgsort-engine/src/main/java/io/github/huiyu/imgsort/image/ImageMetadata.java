package io.github.huiyu.imgsort.image;

import io.github.huiyu.imgsort.ImageType;

import java.nio.ByteBuffer;

public final class ImageMetadata {

    // width, height, size, lastModified, type
    static final int ENCODED_LENGTH = 4 + 4 + 8 + 8 + 1;

    private final int width;
    private final int height;
    private final long size;
    private final ImageType type;
    private final long lastModified;

    public ImageMetadata(int width, int height, long size, ImageType type, long lastModified) {
        this.width = width;
        this.height = height;
        this.size = size;
        this.type = type;
        this.lastModified = lastModified;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getSize() {
        return size;
    }

    public ImageType getType() {
        return type;
    }

    public long getLastModified() {
        return lastModified;
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(ENCODED_LENGTH)
                .putInt(width)
                .putInt(height)
                .putLong(size)
                .putLong(lastModified)
                .put(type.getCode())
                .array();
    }

    public static ImageMetadata fromBytes(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        int width = buffer.getInt();
        int height = buffer.getInt();
        long size = buffer.getLong();
        long lastModified = buffer.getLong();
        ImageType type = ImageType.fromCode(buffer.get());
        return new ImageMetadata(width, height, size, type, lastModified);
    }

    @Override
    public String toString() {
        return "ImageMetadata{" +
                "width=" + width +
                ", height=" + height +
                ", size=" + size +
                ", type=" + type +
                ", lastModified=" + lastModified +
                '}';
    }
}
