package fr.lapetina.inference.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ElemKindTest {

    @ParameterizedTest
    @ValueSource(floats = {0f, 1f, -1f, 0.5f, 2f, 255f, -128f, 65504f})
    @DisplayName("values exactly representable in half precision should survive rounding")
    void exactValues(float value) {
        assertThat(ElemKind.roundToFloat16(value)).isEqualTo(value);
    }

    @Test
    @DisplayName("other values should round to the nearest half")
    void roundsToNearest() {
        float rounded = ElemKind.roundToFloat16(0.1f);

        assertThat(rounded).isNotEqualTo(0.1f);
        assertThat(rounded).isCloseTo(0.1f, within(1e-4f));
        assertThat(ElemKind.roundToFloat16(1.0001f)).isEqualTo(1.0f);
    }

    @Test
    @DisplayName("out of range values should become infinite")
    void overflow() {
        assertThat(ElemKind.roundToFloat16(70000f)).isEqualTo(Float.POSITIVE_INFINITY);
        assertThat(ElemKind.roundToFloat16(-70000f)).isEqualTo(Float.NEGATIVE_INFINITY);
    }

    @Test
    @DisplayName("subnormal halves should be kept and tiny values flushed to zero")
    void subnormals() {
        float smallestSubnormal = (float) Math.pow(2, -24);

        assertThat(ElemKind.roundToFloat16(smallestSubnormal)).isEqualTo(smallestSubnormal);
        assertThat(ElemKind.roundToFloat16(1e-10f)).isZero();
    }

    @Test
    @DisplayName("NaN should stay NaN")
    void nan() {
        assertThat(ElemKind.roundToFloat16(Float.NaN)).isNaN();
    }
}
