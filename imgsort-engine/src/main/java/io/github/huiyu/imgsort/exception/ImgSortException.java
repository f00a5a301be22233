package io.github.huiyu.imgsort.exception;

public class ImgSortException extends RuntimeException {

    private final ErrorKind kind;

    public ImgSortException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ImgSortException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
