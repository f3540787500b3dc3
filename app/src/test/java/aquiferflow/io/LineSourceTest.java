package aquiferflow.io;

import aquiferflow.domain.exception.PackageFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LineSourceTest {

    private static LineSource sourceOf(String text) {
        return new LineSource(new BufferedReader(new StringReader(text)), "test.lpf");
    }

    @Test
    @DisplayName("Los tokens se separan por espacios o comas y respetan las comillas")
    void tokenize_shouldSplitOnWhitespaceAndCommas() {
        assertThat(LineSource.tokenize("  OPEN/CLOSE 'hk layer 1.ref', 1.0  (FREE) -1"))
                .containsExactly("OPEN/CLOSE", "hk layer 1.ref", "1.0", "(FREE)", "-1");
        assertThat(LineSource.tokenize("   ")).isEmpty();
    }

    @Test
    @DisplayName("Los valores en formato libre admiten repeticiones y continúan en varias líneas")
    void readFreeReals_shouldExpandRepeatCounts() throws IOException {
        LineSource source = sourceOf("3*1.5 2.0\n4.0D0, 5.\nnext");

        float[] values = source.readFreeReals(6, "valores");

        assertThat(values).containsExactly(1.5f, 1.5f, 1.5f, 2.0f, 4.0f, 5.0f);
        assertThat(source.getLineNumber()).isEqualTo(2);
        assertThat(source.nextLine("siguiente")).isEqualTo("next");
    }

    @Test
    @DisplayName("Lo que sobra en la última línea leída se descarta")
    void readFreeReals_shouldDiscardRestOfLine() throws IOException {
        LineSource source = sourceOf("1 2 3 comentario\n4");

        assertThat(source.readFreeReals(2, "valores")).containsExactly(1.0f, 2.0f);
        assertThat(source.nextLine("siguiente")).isEqualTo("4");
    }

    @Test
    @DisplayName("El fin de archivo inesperado indica la línea y lo que se esperaba")
    void nextLine_atEndOfFile_shouldThrowFormatException() throws IOException {
        LineSource source = sourceOf("# cabecera\n");
        source.nextLine("comentario");

        assertThatThrownBy(() -> source.nextLine("LAYTYP"))
                .isInstanceOf(PackageFormatException.class)
                .hasMessageContaining("LAYTYP")
                .hasMessageContaining("test.lpf")
                .satisfies(e -> assertThat(((PackageFormatException) e).getLineNumber()).isEqualTo(2));
    }

    @Test
    @DisplayName("Las líneas de comentario iniciales se saltan")
    void nextNonCommentLine_shouldSkipComments() throws IOException {
        LineSource source = sourceOf("# uno\n# dos\n        53\n");

        assertThat(source.nextNonCommentLine("cabecera")).isEqualTo("        53");
        assertThat(source.getLineNumber()).isEqualTo(3);
    }

    @Test
    @DisplayName("Un valor no numérico produce un error de formato con la línea actual")
    void parseReal_withText_shouldThrowFormatException() throws IOException {
        LineSource source = sourceOf("abc\n");
        source.nextLine("valor");

        assertThatThrownBy(() -> source.parseReal("abc", "HDRY"))
                .isInstanceOf(PackageFormatException.class)
                .hasMessageContaining("línea 1");
    }
}
