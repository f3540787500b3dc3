package aquiferflow.io.array;

import aquiferflow.domain.array.ExternalSlice;
import aquiferflow.domain.array.GridSlice;
import aquiferflow.domain.array.LayerSlice;
import aquiferflow.domain.array.UniformSlice;
import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.io.LineSource;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Lee bloques de array 2-D (registro de control más datos) durante una sesión de lectura.
 * <p>
 * Las unidades {@code EXTERNAL} se abren una vez y se leen secuencialmente: dos capas
 * sobre la misma unidad continúan donde terminó la anterior. Los archivos
 * {@code OPEN/CLOSE} se abren y cierran en cada bloque. Al cerrar la sesión se liberan
 * todas las unidades abiertas.
 */
@Slf4j
public class ArrayBlockReader implements AutoCloseable {

    private final Path baseDirectory;
    private final int packageUnit;
    private final Map<Integer, Path> externalUnits;
    private final Map<Integer, LineSource> openUnits = new HashMap<>();
    private final Map<Integer, BufferedReader> openReaders = new HashMap<>();

    /**
     * @param baseDirectory Directorio contra el que se resuelven las rutas relativas.
     * @param packageUnit   Unidad del archivo del paquete (LOCAT igual a ella = datos internos).
     * @param externalUnits Correspondencia unidad → archivo para los bloques {@code EXTERNAL}.
     */
    public ArrayBlockReader(Path baseDirectory, int packageUnit, Map<Integer, Path> externalUnits) {
        this.baseDirectory = baseDirectory != null ? baseDirectory : Paths.get(".");
        this.packageUnit = packageUnit;
        this.externalUnits = externalUnits != null ? externalUnits : Collections.emptyMap();
    }

    /**
     * Lee una capa de {@code nrow x ncol} valores reales.
     *
     * @param source Fuente posicionada justo antes del registro de control.
     * @param label  Nombre de la capa para mensajes y trazas (por ejemplo "hk layer 1").
     */
    public LayerSlice read(LineSource source, String label, int nrow, int ncol) throws IOException {
        String line = source.nextLine("registro de control de " + label);
        ArrayControlRecord control = ArrayControlRecord.parse(line, source.getLineNumber(), packageUnit);
        switch (control.kind()) {
            case CONSTANT:
                return new UniformSlice(control.value());
            case INTERNAL:
                return new GridSlice(scaled(readValues(source, control.format(), nrow, ncol, label), control));
            case EXTERNAL:
                return new GridSlice(scaled(readValues(unit(control.unit(), label, source.getLineNumber()),
                        control.format(), nrow, ncol, label), control));
            case OPEN_CLOSE:
                return readOpenClose(control, label, nrow, ncol);
            default:
                throw new PackageFormatException("Tipo de bloque no soportado: " + control.kind(),
                        source.getLineNumber());
        }
    }

    private LayerSlice readOpenClose(ArrayControlRecord control, String label, int nrow, int ncol)
            throws IOException {
        Path file = baseDirectory.resolve(control.location());
        if (!Files.exists(file)) {
            throw new PackageFormatException("El archivo de " + label + " no existe: " + file.toAbsolutePath());
        }
        log.debug("Leyendo {} desde {}", label, file);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            LineSource external = new LineSource(reader, file.toString());
            float[][] raw = readValues(external, control.format(), nrow, ncol, label);
            return new ExternalSlice(control.location(), control.value(), raw);
        }
    }

    private LineSource unit(int unit, String label, int lineNumber) throws IOException {
        LineSource open = openUnits.get(unit);
        if (open != null) {
            return open;
        }
        Path file = externalUnits.get(unit);
        if (file == null) {
            throw new PackageFormatException(String.format(
                    "La unidad externa %d de %s no está asociada a ningún archivo", unit, label), lineNumber);
        }
        Path resolved = baseDirectory.resolve(file);
        if (!Files.exists(resolved)) {
            throw new PackageFormatException("El archivo de la unidad " + unit + " no existe: "
                    + resolved.toAbsolutePath(), lineNumber);
        }
        BufferedReader reader = Files.newBufferedReader(resolved, StandardCharsets.UTF_8);
        LineSource source = new LineSource(reader, resolved.toString());
        openReaders.put(unit, reader);
        openUnits.put(unit, source);
        return source;
    }

    /**
     * Lee {@code nrow x ncol} valores. En formato libre los valores se leen seguidos; en
     * formato fijo cada fila empieza en una línea nueva.
     */
    static float[][] readValues(LineSource source, FortranFormat format, int nrow, int ncol, String label)
            throws IOException {
        float[][] data = new float[nrow][];
        if (format.free()) {
            float[] flat = source.readFreeReals(nrow * ncol, label);
            for (int i = 0; i < nrow; i++) {
                data[i] = new float[ncol];
                System.arraycopy(flat, i * ncol, data[i], 0, ncol);
            }
            return data;
        }
        for (int i = 0; i < nrow; i++) {
            data[i] = new float[ncol];
            int j = 0;
            while (j < ncol) {
                String line = source.nextLine(label + " fila " + (i + 1));
                for (int c = 0; c < format.count() && j < ncol; c++, j++) {
                    int from = c * format.width();
                    String field = from >= line.length() ? ""
                            : line.substring(from, Math.min(from + format.width(), line.length())).trim();
                    // Un campo en blanco vale cero.
                    data[i][j] = field.isEmpty() ? 0.0f : source.parseReal(field, label);
                }
            }
        }
        return data;
    }

    private static float[][] scaled(float[][] raw, ArrayControlRecord control) {
        for (float[] row : raw) {
            for (int j = 0; j < row.length; j++) {
                row[j] = control.scale(row[j]);
            }
        }
        return raw;
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (Map.Entry<Integer, BufferedReader> entry : openReaders.entrySet()) {
            try {
                entry.getValue().close();
            } catch (IOException e) {
                log.error("No se pudo cerrar la unidad externa {}", entry.getKey(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        openReaders.clear();
        openUnits.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
