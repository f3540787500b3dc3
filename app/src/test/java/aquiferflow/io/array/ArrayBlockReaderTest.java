package aquiferflow.io.array;

import aquiferflow.domain.array.ExternalSlice;
import aquiferflow.domain.array.GridSlice;
import aquiferflow.domain.array.LayerSlice;
import aquiferflow.domain.array.UniformSlice;
import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.io.LineSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArrayBlockReaderTest {

    @TempDir
    Path tempDir;

    private static LineSource sourceOf(String text) {
        return new LineSource(new BufferedReader(new StringReader(text)), "test");
    }

    @Test
    @DisplayName("CONSTANT produce una capa uniforme sin leer más líneas")
    void read_constant() throws IOException {
        LineSource source = sourceOf("CONSTANT 3.5  #hk layer 1\nnext\n");

        try (ArrayBlockReader reader = new ArrayBlockReader(tempDir, 15, Map.of())) {
            LayerSlice slice = reader.read(source, "hk layer 1", 2, 2);

            assertThat(slice).isEqualTo(new UniformSlice(3.5f));
            assertThat(source.nextLine("siguiente")).isEqualTo("next");
        }
    }

    @Test
    @DisplayName("INTERNAL en formato libre aplica el multiplicador")
    void read_internalFree_shouldScale() throws IOException {
        LineSource source = sourceOf("INTERNAL 2.0 (FREE) -1\n1 2 3\n4 5 6\n");

        try (ArrayBlockReader reader = new ArrayBlockReader(tempDir, 15, Map.of())) {
            LayerSlice slice = reader.read(source, "vka layer 1", 2, 3);

            assertThat(slice).isInstanceOf(GridSlice.class);
            assertThat(slice.toArray(2, 3)).isDeepEqualTo(new float[][]{{2, 4, 6}, {8, 10, 12}});
        }
    }

    @Test
    @DisplayName("En formato fijo cada fila empieza en línea nueva y los campos en blanco valen cero")
    void read_internalFixedFormat() throws IOException {
        LineSource source = sourceOf("INTERNAL 1.0 (2F5.1) -1\n  1.0  2.0\n  3.0\n  4.0     \n  6.0\n");

        try (ArrayBlockReader reader = new ArrayBlockReader(tempDir, 15, Map.of())) {
            LayerSlice slice = reader.read(source, "hk layer 1", 2, 3);

            assertThat(slice.toArray(2, 3)).isDeepEqualTo(new float[][]{{1, 2, 3}, {4, 0, 6}});
        }
    }

    @Test
    @DisplayName("Las lecturas de una misma unidad externa continúan donde terminó la anterior")
    void read_externalUnit_shouldReadSequentially() throws IOException {
        Files.writeString(tempDir.resolve("units.dat"), "1 2\n3 4\n");
        LineSource source = sourceOf("EXTERNAL 40 1.0 (FREE) -1\nEXTERNAL 40 10.0 (FREE) -1\n");

        try (ArrayBlockReader reader = new ArrayBlockReader(tempDir, 15, Map.of(40, Paths.get("units.dat")))) {
            LayerSlice first = reader.read(source, "hk layer 1", 1, 2);
            LayerSlice second = reader.read(source, "hk layer 2", 1, 2);

            assertThat(first.toArray(1, 2)).isDeepEqualTo(new float[][]{{1, 2}});
            assertThat(second.toArray(1, 2)).isDeepEqualTo(new float[][]{{30, 40}});
        }
    }

    @Test
    @DisplayName("OPEN/CLOSE conserva la ruta, el multiplicador y los valores crudos")
    void read_openClose_shouldKeepExternalReference() throws IOException {
        Files.writeString(tempDir.resolve("hk1.ref"), "1.5 2.5\n");
        LineSource source = sourceOf("OPEN/CLOSE hk1.ref 2.0 (FREE) -1  #hk layer 1\n");

        try (ArrayBlockReader reader = new ArrayBlockReader(tempDir, 15, Map.of())) {
            LayerSlice slice = reader.read(source, "hk layer 1", 1, 2);

            assertThat(slice).isEqualTo(new ExternalSlice("hk1.ref", 2.0f, new float[][]{{1.5f, 2.5f}}));
            assertThat(slice.toArray(1, 2)).isDeepEqualTo(new float[][]{{3.0f, 5.0f}});
        }
    }

    @Test
    @DisplayName("Una unidad externa sin archivo asociado es un error de formato")
    void read_unknownUnit_shouldThrow() throws IOException {
        LineSource source = sourceOf("EXTERNAL 77 1.0 (FREE) -1\n");

        try (ArrayBlockReader reader = new ArrayBlockReader(tempDir, 15, Map.of())) {
            assertThatThrownBy(() -> reader.read(source, "hk layer 1", 1, 1))
                    .isInstanceOf(PackageFormatException.class)
                    .hasMessageContaining("77");
        }
    }

    @Test
    @DisplayName("Un bloque truncado es un error de formato")
    void read_truncatedBlock_shouldThrow() throws IOException {
        LineSource source = sourceOf("INTERNAL 1.0 (FREE) -1\n1 2 3\n");

        try (ArrayBlockReader reader = new ArrayBlockReader(tempDir, 15, Map.of())) {
            assertThatThrownBy(() -> reader.read(source, "hk layer 1", 2, 2))
                    .isInstanceOf(PackageFormatException.class)
                    .hasMessageContaining("hk layer 1");
        }
    }
}
