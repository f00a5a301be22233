package io.github.huiyu.imgsort.metadata;

import io.github.huiyu.imgsort.ImageType;
import io.github.huiyu.imgsort.image.ImageIdentity;
import io.github.huiyu.imgsort.image.ImageMetadata;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.junit.Assert.*;

public class MapDBMetadataStoreTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private MapDBMetadataStore store;
    private Path image;
    private ImageIdentity identity;

    @Before
    public void setUp() throws IOException {
        store = new MapDBMetadataStore(folder.newFolder("cache").toPath());
        image = folder.newFile("a.png").toPath();
        Files.write(image, new byte[]{1, 2, 3});
        identity = ImageIdentity.of(image);
    }

    @After
    public void tearDown() throws Exception {
        store.destroy();
    }

    @Test
    public void test() throws IOException {
        assertNull(store.get(identity));

        ImageMetadata metadata = describe(640, 480);
        store.save(identity, metadata);
        ImageMetadata actual = store.get(identity);
        assertNotNull(actual);
        assertEquals(640, actual.getWidth());
        assertEquals(480, actual.getHeight());
        assertEquals(3L, actual.getSize());
        assertEquals(ImageType.PNG, actual.getType());

        // update
        store.save(identity, describe(800, 600));
        assertEquals(800, store.get(identity).getWidth());

        store.delete(identity);
        assertNull(store.get(identity));
    }

    @Test
    public void testStaleAfterModification() throws IOException {
        store.save(identity, describe(640, 480));
        Files.setLastModifiedTime(image, FileTime.fromMillis(
                Files.getLastModifiedTime(image).toMillis() + 10000L));
        assertNull(store.get(identity));

        // the stale record was dropped
        store.save(identity, describe(640, 480));
        Files.write(image, new byte[]{1, 2, 3, 4});
        assertNull(store.get(identity));
    }

    @Test
    public void testMissingFile() throws IOException {
        store.save(identity, describe(640, 480));
        Files.delete(image);
        assertNull(store.get(identity));
    }

    private ImageMetadata describe(int width, int height) throws IOException {
        return new ImageMetadata(width, height, Files.size(image), ImageType.PNG,
                Files.getLastModifiedTime(image).toMillis());
    }
}
