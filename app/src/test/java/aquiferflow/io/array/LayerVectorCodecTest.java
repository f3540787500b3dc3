package aquiferflow.io.array;

import aquiferflow.domain.array.LayerVector;
import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.io.LineSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LayerVectorCodecTest {

    private static LineSource sourceOf(String text) {
        return new LineSource(new BufferedReader(new StringReader(text)), "test");
    }

    @Test
    @DisplayName("Los vectores enteros se escriben con I10 y diez valores por línea")
    void format_integralVector() {
        int[] values = new int[12];
        values[11] = 1;

        String text = LayerVectorCodec.format(LayerVector.ofInts("laytyp", values, 12));

        String[] lines = text.split("\n");
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).isEqualTo("         0".repeat(10));
        assertThat(lines[1]).isEqualTo("         0         1");
    }

    @Test
    @DisplayName("Los vectores reales usan la notación exacta en 15 columnas")
    void format_realVector() {
        String text = LayerVectorCodec.format(LayerVector.ofFloats("chani", new float[]{1.0f, -1.0f}, 2));

        assertThat(text).isEqualTo("        1.0E+00       -1.0E+00\n");
    }

    @Test
    @DisplayName("Los vectores enteros se leen hasta completar nlay valores")
    void readInts_shouldSpanLines() throws IOException {
        LineSource source = sourceOf("1 0\n1\n");

        assertThat(LayerVectorCodec.readInts(source, "LAYTYP", 3)).containsExactly(1, 0, 1);
    }

    @Test
    @DisplayName("Un valor no entero en un vector entero es un error de formato")
    void readInts_withFraction_shouldThrow() {
        LineSource source = sourceOf("1 0.5\n");

        assertThatThrownBy(() -> LayerVectorCodec.readInts(source, "LAYWET", 2))
                .isInstanceOf(PackageFormatException.class)
                .hasMessageContaining("LAYWET");
    }
}
