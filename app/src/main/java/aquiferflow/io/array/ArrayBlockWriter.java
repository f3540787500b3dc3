package aquiferflow.io.array;

import aquiferflow.domain.array.ExternalSlice;
import aquiferflow.domain.array.GridSlice;
import aquiferflow.domain.array.LayerSlice;
import aquiferflow.domain.array.UniformSlice;
import aquiferflow.utils.NumberFormats;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Escribe bloques de array 2-D autocontenidos: registro de control y, si procede, los datos.
 * <ul>
 * <li>Capa uniforme: {@code CONSTANT valor  #etiqueta}.</li>
 * <li>Malla: {@code INTERNAL 1.0E+00 (FREE) -1  #etiqueta} seguido de las filas.</li>
 * <li>Externa: {@code OPEN/CLOSE ruta mult (FREE) -1  #etiqueta}; los datos se escriben en
 * el archivo indicado, relativo al directorio de salida.</li>
 * </ul>
 * Cada fila empieza en línea nueva, con un máximo de {@value #VALUES_PER_LINE} valores por línea.
 */
@Slf4j
public class ArrayBlockWriter {

    public static final int VALUES_PER_LINE = 10;
    public static final int REAL_WIDTH = 15;

    private final Path outputDirectory;

    /**
     * @param outputDirectory Directorio donde se escriben los archivos de las capas externas.
     */
    public ArrayBlockWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory != null ? outputDirectory : Paths.get(".");
    }

    /**
     * Escribe el bloque de una capa.
     *
     * @param label Etiqueta de la capa, que aparece como comentario del registro de control.
     */
    public void write(Writer out, LayerSlice slice, String label, int nrow, int ncol) throws IOException {
        if (slice instanceof UniformSlice) {
            out.write("CONSTANT " + NumberFormats.padLeft(NumberFormats.exactFloat(((UniformSlice) slice).value()),
                    REAL_WIDTH) + "  #" + label + "\n");
        } else if (slice instanceof ExternalSlice) {
            ExternalSlice external = (ExternalSlice) slice;
            external.requireShape(nrow, ncol);
            out.write("OPEN/CLOSE " + quoted(external.location()) + " "
                    + NumberFormats.exactFloat(external.multiplier()) + " " + FortranFormat.FREE_TEXT
                    + " -1  #" + label + "\n");
            writeExternalFile(external, label);
        } else if (slice instanceof GridSlice) {
            float[][] values = slice.toArray(nrow, ncol);
            out.write("INTERNAL " + NumberFormats.exactFloat(1.0f) + " " + FortranFormat.FREE_TEXT
                    + " -1  #" + label + "\n");
            writeRows(out, values);
        } else {
            throw new IllegalArgumentException("Tipo de capa no soportado: " + slice.getClass().getName());
        }
    }

    private void writeExternalFile(ExternalSlice external, String label) throws IOException {
        Path file = outputDirectory.resolve(external.location());
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        log.debug("Escribiendo {} en el archivo externo {}", label, file);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeRows(writer, external.values());
        } catch (IOException e) {
            log.error("Error al escribir el archivo externo {}", file.toAbsolutePath(), e);
            throw e;
        }
    }

    static void writeRows(Writer out, float[][] values) throws IOException {
        StringBuilder line = new StringBuilder();
        for (float[] row : values) {
            for (int j = 0; j < row.length; j++) {
                line.append(NumberFormats.padLeft(NumberFormats.exactFloat(row[j]), REAL_WIDTH));
                if ((j + 1) % VALUES_PER_LINE == 0 || j == row.length - 1) {
                    out.write(line.append('\n').toString());
                    line.setLength(0);
                }
            }
        }
    }

    private static String quoted(String location) {
        return location.chars().anyMatch(Character::isWhitespace) ? "'" + location + "'" : location;
    }
}
