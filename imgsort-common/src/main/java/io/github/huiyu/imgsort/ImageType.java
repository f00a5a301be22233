package io.github.huiyu.imgsort;

import static com.google.common.base.Preconditions.checkNotNull;

public enum ImageType {

    JPG("image/jpeg", (byte) 1),
    PNG("image/png", (byte) 2),
    GIF("image/gif", (byte) 3),
    BMP("image/bmp", (byte) 4),
    TIFF("image/tiff", (byte) 5),
    WBMP("image/vnd.wap.wbmp", (byte) 6);

    private final String mimeType;
    private final byte code;

    ImageType(String mimeType, byte code) {
        this.mimeType = mimeType;
        this.code = code;
    }

    public static ImageType fromFileName(String fileName) {
        ImageType type = probeFileName(fileName);
        if (type == null) {
            throw new IllegalArgumentException("Unknown image type " + fileName);
        }
        return type;
    }

    /**
     * Same as {@link #fromFileName(String)} but returns null for files that are not images.
     */
    public static ImageType probeFileName(String fileName) {
        checkNotNull(fileName);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        String suffix = fileName.substring(dot + 1).toUpperCase();
        switch (suffix) {
            case "JPEG":
            case "JPG":
                return JPG;
            case "PNG":
                return PNG;
            case "GIF":
                return GIF;
            case "BMP":
                return BMP;
            case "TIF":
            case "TIFF":
                return TIFF;
            case "WBMP":
                return WBMP;
            default:
                return null;
        }
    }

    public static boolean isImageFile(String fileName) {
        return fileName != null && probeFileName(fileName) != null;
    }

    public static ImageType fromCode(byte code) {
        for (ImageType type : ImageType.values()) {
            if (type.getCode() == code)
                return type;
        }
        throw new IllegalArgumentException("Unknown image code " + code);
    }

    public static ImageType fromMimeType(String mimeType) {
        for (ImageType type : ImageType.values()) {
            if (type.getMimeType().equals(mimeType))
                return type;
        }
        throw new IllegalArgumentException("Unknown mime type: " + mimeType);
    }

    public String getMimeType() {
        return mimeType;
    }

    public byte getCode() {
        return code;
    }

    public String getFileSuffix() {
        return toString().toLowerCase();
    }
}
