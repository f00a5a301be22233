package io.github.huiyu.imgsort.command;

import io.github.huiyu.imgsort.index.Direction;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

public final class Command {

    public enum Type {
        NEXT(Direction.NEXT),
        PREVIOUS(Direction.PREVIOUS),
        FIRST(Direction.FIRST),
        LAST(Direction.LAST),
        RANDOM(Direction.RANDOM),
        DELETE(null),
        UNDO(null),
        SLIDESHOW(null),
        MOVE(null),
        QUIT(null);

        private final Direction direction;

        Type(Direction direction) {
            this.direction = direction;
        }

        /**
         * @return the direction of a navigation command, null for anything else
         */
        public Direction getDirection() {
            return direction;
        }
    }

    private final Type type;
    private final String category;

    private Command(Type type, String category) {
        this.type = type;
        this.category = category;
    }

    public static Command of(Type type) {
        checkNotNull(type);
        if (type == Type.MOVE) {
            throw new IllegalArgumentException("MOVE needs a category");
        }
        return new Command(type, null);
    }

    public static Command move(String category) {
        return new Command(Type.MOVE, checkNotNull(category));
    }

    public Type getType() {
        return type;
    }

    public String getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Command command = (Command) o;
        return type == command.type && Objects.equals(category, command.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, category);
    }

    @Override
    public String toString() {
        return category == null ? type.name() : type + "(" + category + ")";
    }
}
