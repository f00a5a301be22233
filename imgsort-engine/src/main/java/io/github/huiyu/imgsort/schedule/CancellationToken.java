package io.github.huiyu.imgsort.schedule;

public interface CancellationToken {

    boolean isCancelled();
}
