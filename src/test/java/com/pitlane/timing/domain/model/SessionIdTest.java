package com.pitlane.timing.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionIdTest {

    @Test
    void shouldRenderAndParseCompositeValue() {
        SessionId id = SessionId.of(2024, 5, "FP1");

        assertThat(id.value()).isEqualTo("2024_5_FP1");
        assertThat(id.eventId()).isEqualTo("2024_5");
        assertThat(SessionId.parse("2024_5_FP1")).isEqualTo(id);
    }

    @Test
    void shouldRejectMalformedValues() {
        assertThatThrownBy(() -> SessionId.parse("2024_5"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SessionId.parse("2024_x_R"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectInvalidComponents() {
        assertThatThrownBy(() -> SessionId.of(0, 1, "R")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SessionId.of(2024, -1, "R")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SessionId.of(2024, 1, " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SessionId.of(2024, 1, "F_P")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepNullCellsInSessionRows() {
        // Given
        SessionResult result = SessionResult.of(SessionId.of(2024, 5, "R"), "Race", "race",
                List.of(Arrays.asList(1, "VER", null)), null, null);

        // Then
        assertThat(result.rows().get(0)).containsExactly(1, "VER", null);
        assertThat(result.drivers()).isEmpty();
        assertThat(result.id()).isEqualTo(SessionId.of(2024, 5, "R"));
    }
}
