package dev.pekelund.medinterp.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ObservedValueTest {

    @Test
    void textIsReadUpToFirstNonNumericCharacter() {
        assertThat(ObservedValue.of("5.4 H").asNumber()).hasValue(5.4);
        assertThat(ObservedValue.of(" -1.5e2").asNumber()).hasValue(-150.0);
        assertThat(ObservedValue.of(".5").asNumber()).hasValue(0.5);
    }

    @Test
    void textWithoutLeadingNumberHasNoNumericReading() {
        assertThat(ObservedValue.of("negative").asNumber()).isEmpty();
        assertThat(ObservedValue.of("<0.1").asNumber()).isEmpty();
        assertThat(ObservedValue.missing().asNumber()).isEmpty();
    }

    @Test
    void scalingLeavesTextWithoutNumberUntouched() {
        ObservedValue text = ObservedValue.of("pending");

        assertThat(text.scale(2.0)).isSameAs(text);
        assertThat(ObservedValue.of(2.5).scale(2.0)).isEqualTo(ObservedValue.of(5.0));
    }

    @Test
    void nonFiniteNumberIsTreatedAsMissing() {
        assertThat(ObservedValue.of(Double.NaN).isPresent()).isFalse();
    }
}
