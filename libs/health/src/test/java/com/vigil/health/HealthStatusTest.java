package com.vigil.health;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HealthStatus")
class HealthStatusTest {

    @Nested
    @DisplayName("worstOf")
    class WorstOf {

        @Test
        @DisplayName("should pick ERROR over everything else")
        void shouldPickError() {
            assertThat(HealthStatus.worstOf(List.of(HealthStatus.OK, HealthStatus.WARNING, HealthStatus.ERROR)))
                    .isEqualTo(HealthStatus.ERROR);
        }

        @Test
        @DisplayName("should pick WARNING when there is no ERROR")
        void shouldPickWarning() {
            assertThat(HealthStatus.worstOf(List.of(HealthStatus.OK, HealthStatus.WARNING)))
                    .isEqualTo(HealthStatus.WARNING);
        }

        @Test
        @DisplayName("should be OK when every service is OK")
        void shouldBeOk() {
            assertThat(HealthStatus.worstOf(List.of(HealthStatus.OK, HealthStatus.OK)))
                    .isEqualTo(HealthStatus.OK);
        }

        @Test
        @DisplayName("should ignore UNKNOWN next to known statuses")
        void shouldIgnoreUnknown() {
            assertThat(HealthStatus.worstOf(List.of(HealthStatus.OK, HealthStatus.UNKNOWN)))
                    .isEqualTo(HealthStatus.OK);
        }

        @Test
        @DisplayName("should be UNKNOWN when all are UNKNOWN or there are none")
        void shouldBeUnknownWithoutInformation() {
            assertThat(HealthStatus.worstOf(List.of(HealthStatus.UNKNOWN))).isEqualTo(HealthStatus.UNKNOWN);
            assertThat(HealthStatus.worstOf(List.of())).isEqualTo(HealthStatus.UNKNOWN);
        }
    }

    @Test
    @DisplayName("should treat only ERROR and WARNING as failing")
    void shouldClassifyFailing() {
        assertThat(HealthStatus.ERROR.isFailing()).isTrue();
        assertThat(HealthStatus.WARNING.isFailing()).isTrue();
        assertThat(HealthStatus.OK.isFailing()).isFalse();
        assertThat(HealthStatus.UNKNOWN.isFailing()).isFalse();
    }

    @Test
    @DisplayName("should render lower-case names")
    void shouldRenderLowerCase() {
        assertThat(HealthStatus.WARNING.toString()).isEqualTo("warning");
    }
}
