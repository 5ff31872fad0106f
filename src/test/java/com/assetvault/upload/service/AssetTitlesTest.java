package com.assetvault.upload.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AssetTitles")
class AssetTitlesTest {

    @Test
    @DisplayName("should prefer the supplied title, collapsing whitespace")
    void shouldUseSuppliedTitle() {
        assertThat(AssetTitles.normalize("  Spring   campaign ", "ignored.jpg")).isEqualTo("Spring campaign");
    }

    @Test
    @DisplayName("should derive the title from the file name")
    void shouldDeriveFromFileName() {
        assertThat(AssetTitles.normalize(null, "uploads/2024/holiday_photo--01.final.jpg"))
                .isEqualTo("holiday photo 01.final");
        assertThat(AssetTitles.normalize("", "C:\\Users\\me\\brand_logo.png")).isEqualTo("brand logo");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Unknown", "untitled", "Untitled Asset", "   "})
    @DisplayName("should treat placeholder titles as absent")
    void shouldIgnorePlaceholders(String placeholder) {
        assertThat(AssetTitles.normalize(placeholder, "report.pdf")).isEqualTo("report");
        assertThat(AssetTitles.normalize(placeholder, placeholder + ".pdf")).isNull();
    }

    @Test
    @DisplayName("should keep dotfiles whole")
    void shouldKeepLeadingDot() {
        assertThat(AssetTitles.normalize(null, ".profile")).isEqualTo(".profile");
    }

    @Test
    @DisplayName("should return null when nothing usable is supplied")
    void shouldReturnNull() {
        assertThat(AssetTitles.normalize(null, null)).isNull();
        assertThat(AssetTitles.normalize(null, "___.jpg")).isNull();
    }
}
