package io.github.huiyu.imgsort.config;

import com.google.common.collect.Lists;

import io.github.huiyu.imgsort.Const;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@org.springframework.context.annotation.Configuration
public class ConfigurationService implements Configuration, InitializingBean {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationService.class);

    @Autowired
    private LocalConfig localConfig;

    private volatile SortingLayout sortingLayout;

    @Override
    public List<String> getCategories() {
        return localConfig.getCategories();
    }

    @Override
    public List<Path> getStartDirs() {
        return localConfig.getStartDirs().stream()
                .map(d -> Paths.get(d).toAbsolutePath().normalize())
                .collect(Collectors.toList());
    }

    @Override
    public Path getSortDir() {
        String sortDir = localConfig.getSortDir();
        return StringUtils.hasText(sortDir) ? Paths.get(sortDir).toAbsolutePath().normalize() : null;
    }

    @Override
    public Path getCacheDir() {
        return Paths.get(localConfig.getCacheDir()).toAbsolutePath().normalize();
    }

    @Override
    public Path getLogDir() {
        return Paths.get(localConfig.getLogDir()).toAbsolutePath().normalize();
    }

    @Override
    public int getCacheMaxCount() {
        return localConfig.getCacheMaxCount();
    }

    @Override
    public long getCacheMaxBytes() {
        return localConfig.getCacheMaxBytes();
    }

    @Override
    public int getPrefetchRadius() {
        return localConfig.getPrefetchRadius();
    }

    @Override
    public int getWorkers() {
        int workers = localConfig.getWorkers();
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    @Override
    public int getQueueCapacity() {
        return localConfig.getQueueCapacity();
    }

    @Override
    public int getUndoCapacity() {
        return localConfig.getUndoCapacity();
    }

    @Override
    public long getSlideshowInterval() {
        return localConfig.getSlideshowInterval();
    }

    @Override
    public long getSlideshowTimeout() {
        return localConfig.getSlideshowTimeout();
    }

    @Override
    public int getMutationRetryTimes() {
        return localConfig.getMutationRetryTimes();
    }

    @Override
    public long getMutationRetrySleep() {
        return localConfig.getMutationRetrySleep();
    }

    @Override
    public SortingLayout getSortingLayout() {
        return sortingLayout;
    }

    @Override
    public void afterPropertiesSet() throws Exception {
        // check local configurations
        checkLocalConfig(this.localConfig);

        // check and create cache directory
        createDirectoryIfNotExist(getCacheDir());

        this.sortingLayout = SortingLayout.create(getStartDirs(), getSortDir(), getCategories());
        LOG.info("Loaded {}", localConfig);
        LOG.info("Sorting into {}", sortingLayout);
    }

    private void createDirectoryIfNotExist(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            Files.createDirectories(directory);
        } else if (!Files.isDirectory(directory)) {
            throw new IOException(directory + " exists and is not a directory.");
        }
    }

    private void checkLocalConfig(LocalConfig localConfig) {
        List<String> categories = localConfig.getCategories();
        if (categories.size() > Const.MAX_CATEGORIES) {
            throw new IllegalArgumentException("At most " + Const.MAX_CATEGORIES
                    + " categories can be bound to keys, got " + categories.size());
        }
        Set<String> seen = new HashSet<>();
        for (String category : categories) {
            if (!StringUtils.hasText(category) || category.contains("/") || category.contains("\\")) {
                throw new IllegalArgumentException("Illegal category name '" + category + "'");
            }
            if (Const.DELETE_FOLDER_NAME.equals(category)) {
                throw new IllegalArgumentException("'" + category + "' is reserved for deleted images");
            }
            if (!seen.add(category)) {
                throw new IllegalArgumentException("Duplicated category '" + category + "'");
            }
        }
        if (localConfig.getStartDirs().isEmpty()) {
            throw new IllegalArgumentException("At least one start directory is required");
        }
        // current image and its two neighbors are pinned
        if (localConfig.getCacheMaxCount() < 3) {
            throw new IllegalArgumentException("cache-max-count must be at least 3");
        }
        if (localConfig.getCacheMaxBytes() <= 0) {
            throw new IllegalArgumentException("cache-max-bytes must be positive");
        }
        if (localConfig.getPrefetchRadius() < 0) {
            throw new IllegalArgumentException("prefetch-radius must not be negative");
        }
        if (localConfig.getQueueCapacity() <= 0 || localConfig.getUndoCapacity() <= 0) {
            throw new IllegalArgumentException("queue-capacity and undo-capacity must be positive");
        }
        if (localConfig.getSlideshowInterval() <= 0 || localConfig.getSlideshowTimeout() <= 0) {
            throw new IllegalArgumentException("slideshow interval and timeout must be positive");
        }
    }

    @Bean
    protected LocalConfig loadLocalConfig() {
        return new LocalConfig();
    }

    @ConfigurationProperties("imgsort")
    protected static class LocalConfig implements Serializable {

        private List<String> categories = new ArrayList<>();
        private List<String> startDirs = Lists.newArrayList(".");
        private String sortDir;
        private String cacheDir = Paths.get(System.getProperty("user.home"), ".config", Const.APP_NAME, "cache").toString();
        private String logDir = Paths.get(System.getProperty("user.home"), ".config", Const.APP_NAME, "logs").toString();
        private int cacheMaxCount = Const.DEFAULT_CACHE_MAX_COUNT;
        private long cacheMaxBytes = Const.DEFAULT_CACHE_MAX_BYTES;
        private int prefetchRadius = Const.DEFAULT_PREFETCH_RADIUS;
        private int workers;
        private int queueCapacity = 64;
        private int undoCapacity = 100;
        private long slideshowInterval = Const.DEFAULT_SLIDESHOW_INTERVAL_MILLIS;
        private long slideshowTimeout = Const.DEFAULT_SLIDESHOW_TIMEOUT_MILLIS;
        private int mutationRetryTimes = 2;
        private long mutationRetrySleep = 100L;

        public List<String> getCategories() {
            return categories;
        }

        public void setCategories(List<String> categories) {
            this.categories = categories;
        }

        public List<String> getStartDirs() {
            return startDirs;
        }

        public void setStartDirs(List<String> startDirs) {
            this.startDirs = startDirs;
        }

        public String getSortDir() {
            return sortDir;
        }

        public void setSortDir(String sortDir) {
            this.sortDir = sortDir;
        }

        public String getCacheDir() {
            return cacheDir;
        }

        public void setCacheDir(String cacheDir) {
            this.cacheDir = cacheDir;
        }

        public String getLogDir() {
            return logDir;
        }

        public void setLogDir(String logDir) {
            this.logDir = logDir;
        }

        public int getCacheMaxCount() {
            return cacheMaxCount;
        }

        public void setCacheMaxCount(int cacheMaxCount) {
            this.cacheMaxCount = cacheMaxCount;
        }

        public long getCacheMaxBytes() {
            return cacheMaxBytes;
        }

        public void setCacheMaxBytes(long cacheMaxBytes) {
            this.cacheMaxBytes = cacheMaxBytes;
        }

        public int getPrefetchRadius() {
            return prefetchRadius;
        }

        public void setPrefetchRadius(int prefetchRadius) {
            this.prefetchRadius = prefetchRadius;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getUndoCapacity() {
            return undoCapacity;
        }

        public void setUndoCapacity(int undoCapacity) {
            this.undoCapacity = undoCapacity;
        }

        public long getSlideshowInterval() {
            return slideshowInterval;
        }

        public void setSlideshowInterval(long slideshowInterval) {
            this.slideshowInterval = slideshowInterval;
        }

        public long getSlideshowTimeout() {
            return slideshowTimeout;
        }

        public void setSlideshowTimeout(long slideshowTimeout) {
            this.slideshowTimeout = slideshowTimeout;
        }

        public int getMutationRetryTimes() {
            return mutationRetryTimes;
        }

        public void setMutationRetryTimes(int mutationRetryTimes) {
            this.mutationRetryTimes = mutationRetryTimes;
        }

        public long getMutationRetrySleep() {
            return mutationRetrySleep;
        }

        public void setMutationRetrySleep(long mutationRetrySleep) {
            this.mutationRetrySleep = mutationRetrySleep;
        }

        @Override
        public String toString() {
            return "LocalConfig{" +
                    "categories=" + categories +
                    ", startDirs=" + startDirs +
                    ", sortDir='" + sortDir + '\'' +
                    ", cacheDir='" + cacheDir + '\'' +
                    ", logDir='" + logDir + '\'' +
                    ", cacheMaxCount=" + cacheMaxCount +
                    ", cacheMaxBytes=" + cacheMaxBytes +
                    ", prefetchRadius=" + prefetchRadius +
                    ", workers=" + workers +
                    ", queueCapacity=" + queueCapacity +
                    ", undoCapacity=" + undoCapacity +
                    ", slideshowInterval=" + slideshowInterval +
                    ", slideshowTimeout=" + slideshowTimeout +
                    ", mutationRetryTimes=" + mutationRetryTimes +
                    ", mutationRetrySleep=" + mutationRetrySleep +
                    '}';
        }
    }
}
