package io.github.huiyu.imgsort.exception;

public enum ErrorKind {

    /**
     * The file is gone from disk, the identity is dropped from index and cache.
     */
    NOT_FOUND,

    /**
     * Content is unreadable or corrupt.
     */
    DECODE,

    /**
     * Move or delete failed, nothing was changed.
     */
    FILESYSTEM,

    /**
     * The decoded image does not fit the cache budget and is served without caching.
     */
    CAPACITY,

    /**
     * Undo with nothing to undo. Informational only.
     */
    EMPTY_UNDO
}
