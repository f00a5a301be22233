package io.github.huiyu.imgsort.config;

import java.nio.file.Path;
import java.util.List;

public interface Configuration {

    List<String> getCategories();

    List<Path> getStartDirs();

    Path getSortDir();

    Path getCacheDir();

    Path getLogDir();

    int getCacheMaxCount();

    long getCacheMaxBytes();

    int getPrefetchRadius();

    int getWorkers();

    int getQueueCapacity();

    int getUndoCapacity();

    long getSlideshowInterval();

    long getSlideshowTimeout();

    int getMutationRetryTimes();

    long getMutationRetrySleep();

    SortingLayout getSortingLayout();
}
