package capture;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class MarkerStatusFormatterTest {

    @Test
    @DisplayName("Guidance text names the most pressing marker problem")
    void guidanceText_Priorities() {
        assertThat(MarkerStatusFormatter.guidanceText(0, List.of(3L), List.of(3L), false)).isEqualTo("No markers detected");
        assertThat(MarkerStatusFormatter.guidanceText(2, List.of(3L, 7L, 9L), List.of(3L, 7L), false))
            .isEqualTo("Missing required: 3,7");
        assertThat(MarkerStatusFormatter.guidanceText(2, List.of(), List.of(), false))
            .isEqualTo("Reframe: keep tags away from edges");
        assertThat(MarkerStatusFormatter.guidanceText(2, List.of(3L), List.of(), true)).isEqualTo("Markers OK");
    }

    @Test
    @DisplayName("Display text counts markers and required ids")
    void displayText_Variants() {
        assertThat(MarkerStatusFormatter.displayText(5, List.of(1L, 2L, 3L), List.of(3L), false))
            .isEqualTo("Markers: 5 | required 2/3 | edge");
        assertThat(MarkerStatusFormatter.displayText(1, List.of(), List.of(), true)).isEqualTo("Markers: 1");
    }

    @Test
    @DisplayName("Focus distance is shown in centimeters and diopters")
    void formatFocusDistance_Values() {
        assertThat(MarkerStatusFormatter.formatFocusDistance(null)).isEqualTo("fd=—");
        assertThat(MarkerStatusFormatter.formatFocusDistance(0f)).isEqualTo("fd=∞");
        assertThat(MarkerStatusFormatter.formatFocusDistance(4f)).isEqualTo("fd≈25cm (4.00D)");
        assertThat(MarkerStatusFormatter.formatFocusDistance(3f)).isEqualTo("fd≈33cm (3.00D)");
    }
}
