package io.github.huiyu.imgsort.index;

public enum Direction {

    NEXT(true),
    PREVIOUS(true),
    FIRST(false),
    LAST(false),
    RANDOM(true);

    private final boolean cycle;

    Direction(boolean cycle) {
        this.cycle = cycle;
    }

    /**
     * Whether the slideshow can keep cycling in this direction.
     */
    public boolean isCycle() {
        return cycle;
    }
}
