package com.assetvault.upload.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AssetType")
class AssetTypeTest {

    @ParameterizedTest
    @CsvSource({
            "image/jpeg, IMAGE",
            "IMAGE/PNG, IMAGE",
            "video/mp4, VIDEO",
            "audio/mpeg, AUDIO",
            "application/pdf, DOCUMENT",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document, DOCUMENT",
            "application/zip, OTHER"
    })
    @DisplayName("should resolve the family from the content type")
    void shouldResolveFromMimeType(String mimeType, AssetType expected) {
        assertThat(AssetType.fromMimeType(mimeType)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should fall back to OTHER without a content type")
    void shouldDefaultToOther() {
        assertThat(AssetType.fromMimeType(null)).isEqualTo(AssetType.OTHER);
        assertThat(AssetType.fromMimeType(" ")).isEqualTo(AssetType.OTHER);
    }

    @Test
    @DisplayName("should declare derivative capabilities per family")
    void shouldDeclareCapabilities() {
        assertThat(AssetType.VIDEO.needs(AssetType.Derivative.VIDEO_PREVIEW)).isTrue();
        assertThat(AssetType.IMAGE.needs(AssetType.Derivative.VIDEO_PREVIEW)).isFalse();
        assertThat(AssetType.IMAGE.needs(AssetType.Derivative.THUMBNAIL)).isTrue();
        assertThat(AssetType.AUDIO.needs(AssetType.Derivative.THUMBNAIL)).isFalse();
    }
}
