package com.example.ps3update.util;

import com.example.ps3update.exception.InvalidTitleIdException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatUtilsTest {

    @Test
    void formatSizeUsesBinaryUnitsWithTwoDecimals() {
        assertThat(FormatUtils.formatSize(123456789)).isEqualTo("117.74 MB");
        assertThat(FormatUtils.formatSize(512)).isEqualTo("512.00 B");
        assertThat(FormatUtils.formatSize(1024)).isEqualTo("1.00 KB");
        assertThat(FormatUtils.formatSize(1048576)).isEqualTo("1.00 MB");
        assertThat(FormatUtils.formatSize(5L * 1024 * 1024 * 1024)).isEqualTo("5.00 GB");
    }

    @Test
    void formatSizeOfZeroIsDefined() {
        assertThat(FormatUtils.formatSize(0)).isEqualTo("0 B");
        assertThat(FormatUtils.formatSize(-5)).isEqualTo("0 B");
    }

    @Test
    void formatSpeedAppendsPerSecond() {
        assertThat(FormatUtils.formatSpeed(0)).isEqualTo("0 B/s");
        assertThat(FormatUtils.formatSpeed(2048)).isEqualTo("2.00 KB/s");
    }

    @ParameterizedTest
    @ValueSource(strings = {"bles-00799", "BLES 00799", "BLES00799", "  bles_00799 ", "Bles.00799"})
    void cleanTitleIdNormalizesCaseAndSeparators(String raw) {
        assertThat(FormatUtils.cleanTitleId(raw)).isEqualTo("BLES00799");
    }

    @Test
    void cleanTitleIdIsIdempotent() {
        String once = FormatUtils.cleanTitleId("npua-80662");
        assertThat(FormatUtils.cleanTitleId(once)).isEqualTo(once).isEqualTo("NPUA80662");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "BLES0079", "BLES007999", "BLE00799", "BLES0079X", "12345BLES", "BLES@00799", "BLÉS00799"})
    void cleanTitleIdRejectsInvalidInput(String raw) {
        assertThatThrownBy(() -> FormatUtils.cleanTitleId(raw))
                .isInstanceOf(InvalidTitleIdException.class)
                .hasMessageContaining("Invalid title ID");
    }

    @Test
    void cleanTitleIdRejectsNull() {
        assertThatThrownBy(() -> FormatUtils.cleanTitleId(null)).isInstanceOf(InvalidTitleIdException.class);
    }
}
