package io.github.huiyu.imgsort.image;

import io.github.huiyu.imgsort.ImageType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

@Component
public class ImageIODecoder implements ImageDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(ImageIODecoder.class);

    // ARGB
    private static final int BYTES_PER_PIXEL = 4;

    static {
        ImageIO.setUseCache(false);
    }

    @Override
    public DecodedImage decode(ImageIdentity identity) throws IOException {
        Path path = identity.getPath();
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("No reader can decode " + path);
        }
        ImageMetadata metadata = new ImageMetadata(
                image.getWidth(),
                image.getHeight(),
                attributes.size(),
                ImageType.fromFileName(identity.getFileName()),
                attributes.lastModifiedTime().toMillis());
        long cost = (long) image.getWidth() * image.getHeight() * BYTES_PER_PIXEL;
        if (LOG.isTraceEnabled()) {
            LOG.trace("Decoded {} {}x{}", identity, image.getWidth(), image.getHeight());
        }
        return new DecodedImage(image, cost, metadata);
    }

    @Override
    public ImageMetadata readMetadata(ImageIdentity identity) throws IOException {
        Path path = identity.getPath();
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                throw new IOException("Can not open " + path);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new IOException("No reader for " + path);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new ImageMetadata(
                        reader.getWidth(0),
                        reader.getHeight(0),
                        attributes.size(),
                        ImageType.fromFileName(identity.getFileName()),
                        attributes.lastModifiedTime().toMillis());
            } finally {
                reader.dispose();
            }
        }
    }
}
