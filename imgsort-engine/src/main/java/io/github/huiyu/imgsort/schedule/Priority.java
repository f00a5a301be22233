package io.github.huiyu.imgsort.schedule;

public enum Priority {

    /**
     * The image the user is waiting for.
     */
    INTERACTIVE,

    /**
     * Prefetch, metadata and file mutations.
     */
    BACKGROUND
}
