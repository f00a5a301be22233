package io.github.huiyu.imgsort.config;

import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.junit4.SpringJUnit4ClassRunner;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

@RunWith(SpringJUnit4ClassRunner.class)
@ContextConfiguration(classes = ConfigurationServiceTest.TestContextConfig.class)
public class ConfigurationServiceTest {

    @Autowired
    private TestContextConfig contextConfig;
    @Autowired
    private ConfigurationService configurationService;

    @Test
    public void testAutomaticCreateCacheDirectory() {
        assertTrue(contextConfig.cacheFolder.isDirectory());
        assertEquals(contextConfig.cacheFolder.toPath().toAbsolutePath().normalize(),
                configurationService.getCacheDir());
    }

    @Test
    public void testSortingLayout() {
        Path photos = contextConfig.photosFolder.toPath().toAbsolutePath().normalize();
        SortingLayout layout = configurationService.getSortingLayout();
        assertNotNull(layout);
        assertEquals(Collections.singletonList(photos), layout.getStartDirs());
        assertEquals(Arrays.asList("keep", "later"), configurationService.getCategories());
        assertEquals(photos.resolve("keep"), layout.destinationFor(photos.resolve("a.png"), "keep"));
        assertEquals(photos.resolve("deleted"), layout.deleteFolderFor(photos.resolve("a.png")));
        assertNull(configurationService.getSortDir());
    }

    @Test
    public void testWorkersDefaultToProcessors() {
        assertEquals(Runtime.getRuntime().availableProcessors(), configurationService.getWorkers());
        assertEquals(3000L, configurationService.getSlideshowInterval());
        assertEquals(60000L, configurationService.getSlideshowTimeout());
    }

    @Test
    public void testStartDirsDefaultToWorkingDirectory() {
        ConfigurationService.LocalConfig localConfig = new ConfigurationService.LocalConfig();
        assertEquals(Collections.singletonList("."), localConfig.getStartDirs());
        // bound lists are appended to
        localConfig.getStartDirs().add("/photos");
        assertEquals(2, localConfig.getStartDirs().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReservedCategory() throws Exception {
        ConfigurationService.LocalConfig localConfig = validConfig();
        localConfig.setCategories(Arrays.asList("keep", "deleted"));
        load(localConfig);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicatedCategory() throws Exception {
        ConfigurationService.LocalConfig localConfig = validConfig();
        localConfig.setCategories(Arrays.asList("keep", "keep"));
        load(localConfig);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooManyCategories() throws Exception {
        ConfigurationService.LocalConfig localConfig = validConfig();
        localConfig.setCategories(Arrays.asList("1", "2", "3", "4", "5", "6", "7", "8", "9", "10"));
        load(localConfig);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCacheTooSmallForNeighbors() throws Exception {
        ConfigurationService.LocalConfig localConfig = validConfig();
        localConfig.setCacheMaxCount(2);
        load(localConfig);
    }

    private ConfigurationService.LocalConfig validConfig() {
        ConfigurationService.LocalConfig localConfig = new ConfigurationService.LocalConfig();
        localConfig.setStartDirs(Collections.singletonList(contextConfig.photosFolder.getPath()));
        localConfig.setCacheDir(contextConfig.cacheFolder.getPath());
        return localConfig;
    }

    private void load(ConfigurationService.LocalConfig localConfig) throws Exception {
        ConfigurationService service = new ConfigurationService();
        ReflectionTestUtils.setField(service, "localConfig", localConfig);
        service.afterPropertiesSet();
    }

    @org.springframework.context.annotation.Configuration
    public static class TestContextConfig implements DisposableBean {

        private TemporaryFolder tempFolder = new TemporaryFolder();
        private File photosFolder;
        private File cacheFolder;

        public TestContextConfig() throws Exception {
            tempFolder.create();
            photosFolder = tempFolder.newFolder("photos");
        }

        @Bean
        public ConfigurationService.LocalConfig localConfig() {
            ConfigurationService.LocalConfig localConfig = new ConfigurationService.LocalConfig();
            localConfig.setCategories(Arrays.asList("keep", "later"));
            localConfig.setStartDirs(Collections.singletonList(photosFolder.getAbsolutePath()));
            cacheFolder = new File(tempFolder.getRoot().getAbsoluteFile(), "cache");
            localConfig.setCacheDir(cacheFolder.getAbsolutePath());
            return localConfig;
        }

        @Bean
        public ConfigurationService configurationService() {
            return new ConfigurationService();
        }

        @Override
        public void destroy() throws Exception {
            tempFolder.delete();
        }
    }
}
