package io.github.huiyu.imgsort.image;

import java.io.IOException;

public interface ImageDecoder {

    /**
     * Decode the full image. Runs on a worker thread.
     *
     * @throws java.nio.file.NoSuchFileException if the file is gone
     * @throws IOException if the content can not be decoded
     */
    DecodedImage decode(ImageIdentity identity) throws IOException;

    /**
     * Read metadata only, without decoding pixels where the format allows it.
     */
    ImageMetadata readMetadata(ImageIdentity identity) throws IOException;
}
