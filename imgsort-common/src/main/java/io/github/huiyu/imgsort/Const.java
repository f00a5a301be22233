package io.github.huiyu.imgsort;

public final class Const {

    public static final String APP_NAME = "imgsort";

    public static final String DELETE_FOLDER_NAME = "deleted";

    public static final long DEFAULT_SLIDESHOW_INTERVAL_MILLIS = 3000L;

    public static final long DEFAULT_SLIDESHOW_TIMEOUT_MILLIS = 60000L;

    public static final int DEFAULT_CACHE_MAX_COUNT = 500;

    public static final long DEFAULT_CACHE_MAX_BYTES = 100L * 1024L * 1024L;

    public static final int DEFAULT_PREFETCH_RADIUS = 2;

    public static final int MAX_CATEGORIES = 9;

    private Const() {
    }
}
