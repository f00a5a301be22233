package io.github.huiyu.imgsort.schedule;

import io.github.huiyu.imgsort.exception.ErrorKind;
import io.github.huiyu.imgsort.image.ImageIdentity;

import static com.google.common.base.Preconditions.checkNotNull;

public final class Task<T> {

    public enum Kind {
        LOAD(ErrorKind.DECODE, true),
        METADATA(ErrorKind.DECODE, true),
        MOVE(ErrorKind.FILESYSTEM, false),
        DELETE(ErrorKind.FILESYSTEM, false),
        UNDO(ErrorKind.FILESYSTEM, false);

        private final ErrorKind defaultError;
        private final boolean sheddable;

        Kind(ErrorKind defaultError, boolean sheddable) {
            this.defaultError = defaultError;
            this.sheddable = sheddable;
        }

        /**
         * Whether queued work of this kind may be dropped under backpressure.
         */
        public boolean isSheddable() {
            return sheddable;
        }

        /**
         * Error kind reported for an unclassified failure of this kind of work.
         */
        public ErrorKind getDefaultError() {
            return defaultError;
        }
    }

    @FunctionalInterface
    public interface Work<T> {

        T run(CancellationToken token) throws Exception;
    }

    private final ImageIdentity identity;
    private final Kind kind;
    private final Priority priority;
    private final Work<T> work;

    private Task(ImageIdentity identity, Kind kind, Priority priority, Work<T> work) {
        this.identity = checkNotNull(identity);
        this.kind = checkNotNull(kind);
        this.priority = checkNotNull(priority);
        this.work = checkNotNull(work);
    }

    public static <T> Task<T> of(ImageIdentity identity, Kind kind, Priority priority, Work<T> work) {
        return new Task<>(identity, kind, priority, work);
    }

    public ImageIdentity getIdentity() {
        return identity;
    }

    public Kind getKind() {
        return kind;
    }

    public Priority getPriority() {
        return priority;
    }

    public Work<T> getWork() {
        return work;
    }

    @Override
    public String toString() {
        return kind + "(" + identity + ", " + priority + ")";
    }
}
