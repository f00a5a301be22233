package io.github.huiyu.imgsort.metadata;

import io.github.huiyu.imgsort.config.Configuration;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;

import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.HTreeMap;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

@Component
@ConditionalOnProperty(prefix = "imgsort", name = "metadata.mode", havingValue = "mapdb")
public class MapDBMetadataStore implements MetadataStore, DisposableBean {

    private static final Logger LOG = LoggerFactory.getLogger(MapDBMetadataStore.class);

    static final String STORE_FILE = "metadata.db";
    private static final String MAP_METADATA = "metadata";

    private final DB db;
    private final HTreeMap<String, byte[]> metadataMap;

    @Autowired
    public MapDBMetadataStore(Configuration config) {
        this(config.getCacheDir());
    }

    public MapDBMetadataStore(Path cacheDir) {
        Path file = cacheDir.resolve(STORE_FILE);
        LOG.info("Open metadata store {}", file);
        this.db = DBMaker
                .fileDB(file.toFile())
                .fileMmapEnableIfSupported()
                .closeOnJvmShutdown()
                .make();
        this.metadataMap = db
                .hashMap(MAP_METADATA, Serializer.STRING, Serializer.BYTE_ARRAY)
                .createOrOpen();
    }

    @Override
    public ImageMetadata get(ImageIdentity identity) {
        String key = identity.getPath().toString();
        byte[] data = metadataMap.get(key);
        if (data == null) {
            return null;
        }
        ImageMetadata metadata = ImageMetadata.fromBytes(data);
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(identity.getPath(), BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            metadataMap.remove(key);
            return null;
        } catch (IOException e) {
            LOG.warn("Can not stat {}, ignore stored metadata: {}", identity, e.toString());
            return null;
        }
        if (attributes.size() != metadata.getSize()
                || attributes.lastModifiedTime().toMillis() != metadata.getLastModified()) {
            if (LOG.isTraceEnabled()) {
                LOG.trace("Stale metadata for {}", identity);
            }
            metadataMap.remove(key);
            return null;
        }
        return metadata;
    }

    @Override
    public void save(ImageIdentity identity, ImageMetadata metadata) {
        metadataMap.put(identity.getPath().toString(), metadata.toBytes());
    }

    @Override
    public void delete(ImageIdentity identity) {
        metadataMap.remove(identity.getPath().toString());
    }

    @Override
    public void destroy() throws Exception {
        metadataMap.close();
        db.close();
    }
}
