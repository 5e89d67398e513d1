package com.edge.astrometry.core.calibration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalibrationModeTest {

    @Test
    void parsesKeysCaseInsensitively() {
        assertThat(CalibrationMode.fromKey("Distortion")).isEqualTo(CalibrationMode.DISTORTION);
        assertThat(CalibrationMode.fromKey(" shift ")).isEqualTo(CalibrationMode.SHIFT);
        assertThat(CalibrationMode.fromKey(null)).isEqualTo(CalibrationMode.OTASHEAR);
        assertThat(CalibrationMode.fromKey("")).isEqualTo(CalibrationMode.OTASHEAR);
    }

    @Test
    void rejectsUnknownMode() {
        assertThatThrownBy(() -> CalibrationMode.fromKey("affine"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("affine");
    }

    @Test
    void modesRunStagesUpToTheirLastStage() {
        assertThat(CalibrationMode.SHIFT.runs(CalibrationStage.SHIFT_ONLY)).isTrue();
        assertThat(CalibrationMode.SHIFT.runs(CalibrationStage.ROTATION_SEARCH)).isFalse();
        assertThat(CalibrationMode.ROTATION.runs(CalibrationStage.ROTATION_SEARCH)).isTrue();
        assertThat(CalibrationMode.ROTATION.runs(CalibrationStage.PER_TILE_SHIFT)).isFalse();
        assertThat(CalibrationMode.OTASHEAR.runs(CalibrationStage.PER_TILE_SHIFT)).isTrue();
        assertThat(CalibrationMode.OTASHEAR.runs(CalibrationStage.PER_TILE_SHEAR)).isTrue();
        assertThat(CalibrationMode.OTASHEAR.runs(CalibrationStage.DISTORTION_FIT)).isFalse();
        assertThat(CalibrationMode.DISTORTION.runs(CalibrationStage.DISTORTION_FIT)).isTrue();
        assertThat(CalibrationMode.DISTORTION.runs(CalibrationStage.SHIFT_ONLY)).isFalse();
    }
}
