package aquiferflow.domain.array;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LayerVectorTest {

    @Test
    @DisplayName("Un valor único se difunde a todas las capas")
    void ofInts_withSingleValue_shouldBroadcast() {
        LayerVector vector = LayerVector.ofInts("laytyp", new int[]{1}, 3);

        assertThat(vector.size()).isEqualTo(3);
        assertThat(vector.toIntArray()).containsExactly(1, 1, 1);
        assertThat(vector.isIntegral()).isTrue();
        assertThat(vector.sum()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Un vector con longitud distinta de 1 y nlay es rechazado")
    void ofFloats_withWrongLength_shouldThrow() {
        assertThatThrownBy(() -> LayerVector.ofFloats("chani", new float[]{1.0f, 0.5f}, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chani");
    }

    @Test
    @DisplayName("Los vectores reales conservan los valores de cada capa")
    void ofFloats_withFullLength_shouldKeepValues() {
        LayerVector vector = LayerVector.ofFloats("chani", new float[]{1.0f, -1.0f}, 2);

        assertThat(vector.isIntegral()).isFalse();
        assertThat(vector.getFloat(1)).isEqualTo(-1.0f);
        assertThat(vector.toFloatArray()).containsExactly(1.0f, -1.0f);
    }

    @Test
    @DisplayName("El array devuelto es una copia")
    void toIntArray_shouldReturnCopy() {
        LayerVector vector = LayerVector.ofInts("laywet", new int[]{0, 1}, 2);

        int[] copy = vector.toIntArray();
        copy[0] = 99;

        assertThat(vector.getInt(0)).isZero();
    }
}
