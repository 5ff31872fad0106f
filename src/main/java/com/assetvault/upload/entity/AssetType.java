package com.assetvault.upload.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * File family of an asset, resolved once from the verified content type. Each family
 * declares the downstream derivatives it needs, so consumers switch on capabilities
 * rather than on mime strings.
 */
public enum AssetType {
    IMAGE(EnumSet.of(Derivative.THUMBNAIL)),
    VIDEO(EnumSet.of(Derivative.THUMBNAIL, Derivative.VIDEO_PREVIEW)),
    AUDIO(EnumSet.noneOf(Derivative.class)),
    DOCUMENT(EnumSet.of(Derivative.THUMBNAIL)),
    OTHER(EnumSet.noneOf(Derivative.class));

    public enum Derivative { THUMBNAIL, VIDEO_PREVIEW }

    private final Set<Derivative> derivatives;

    AssetType(Set<Derivative> derivatives) {
        this.derivatives = derivatives;
    }

    public boolean needs(Derivative derivative) {
        return derivatives.contains(derivative);
    }

    public static AssetType fromMimeType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return OTHER;
        }
        String s = mimeType.toLowerCase();
        if (s.startsWith("image/")) return IMAGE;
        if (s.startsWith("video/")) return VIDEO;
        if (s.startsWith("audio/")) return AUDIO;
        if (s.contains("pdf") || s.contains("document") || s.startsWith("text/plain")) return DOCUMENT;
        return OTHER;
    }
}
