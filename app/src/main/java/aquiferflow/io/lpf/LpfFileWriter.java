package aquiferflow.io.lpf;

import aquiferflow.domain.lpf.LpfField;
import aquiferflow.domain.lpf.LpfOption;
import aquiferflow.domain.lpf.LpfPackage;
import aquiferflow.domain.lpf.WettingControl;
import aquiferflow.domain.model.GroundwaterModel;
import aquiferflow.io.array.ArrayBlockWriter;
import aquiferflow.io.array.LayerVectorCodec;
import aquiferflow.validation.CheckLevel;
import aquiferflow.validation.LpfChecker;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Escribe el paquete LPF en el formato de texto posicional de MODFLOW.
 * <p>
 * Las definiciones de parámetros no se escriben nunca: los valores de los campos ya están
 * materializados en el paquete, así que NPLPF se escribe siempre como cero.
 */
@Slf4j
public class LpfFileWriter {

    public static final String HEADING = "# LPF for MODFLOW, generated by AquiferFlow.";
    /** Nombre del archivo de informe de validación, en el directorio de trabajo del modelo. */
    public static final String CHECK_FILE = "LPF.chk";

    private final LpfChecker checker;

    public LpfFileWriter() {
        this(new LpfChecker());
    }

    public LpfFileWriter(LpfChecker checker) {
        this.checker = Objects.requireNonNull(checker, "El validador no puede ser nulo.");
    }

    /**
     * Escribe el paquete en {@code <workspace>/<nombre>.<extension>}, validándolo antes.
     *
     * @return Ruta del archivo escrito.
     */
    public Path write(LpfPackage lpf, GroundwaterModel model) throws IOException {
        Path path = model.resolveFile(lpf.getExtension());
        write(lpf, model, path, true);
        return path;
    }

    /**
     * Escribe el paquete en la ruta indicada.
     *
     * @param check Si es verdadero, guarda un informe detallado en {@code <workspace>/LPF.chk}
     *              y lo muestra por la salida estándar cuando el modelo es verboso.
     * @throws IllegalArgumentException si el paquete no corresponde a la malla del modelo.
     */
    public void write(LpfPackage lpf, GroundwaterModel model, Path path, boolean check) throws IOException {
        Objects.requireNonNull(lpf, "El paquete no puede ser nulo.");
        lpf.requireSameGrid(model);
        if (check) {
            checker.check(lpf, model, CheckLevel.DETAILED, model.getWorkspace().resolve(CHECK_FILE),
                    model.isVerbose() ? System.out : null);
        }

        log.info("Escribiendo el paquete LPF en {}", path.toAbsolutePath());
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(lpf, model, out, new ArrayBlockWriter(parent));
        } catch (IOException e) {
            log.error("Error al escribir el paquete LPF en {}", path.toAbsolutePath(), e);
            throw e;
        }
        log.info("Paquete LPF escrito: {} capas.", lpf.getLayerCount());
    }

    /**
     * Codifica el paquete en memoria. Las capas externas escriben sus archivos de datos en
     * el directorio de trabajo del modelo.
     */
    public String encode(LpfPackage lpf, GroundwaterModel model) throws IOException {
        Objects.requireNonNull(lpf, "El paquete no puede ser nulo.");
        lpf.requireSameGrid(model);
        StringWriter out = new StringWriter();
        write(lpf, model, out, new ArrayBlockWriter(model.getWorkspace()));
        return out.toString();
    }

    /**
     * Escribe la secuencia completa del paquete sobre un {@link Writer} ya abierto.
     */
    public void write(LpfPackage lpf, GroundwaterModel model, Writer out, ArrayBlockWriter arrays)
            throws IOException {
        if (lpf.getParameterCount() != 0) {
            log.warn("El paquete declara {} parámetros; se escriben sus valores materializados y NPLPF=0.",
                    lpf.getParameterCount());
        }
        out.write(HEADING + "\n");
        out.write(new LpfHeader(lpf.getSaveBudgetFlag(), lpf.getDryHead(), 0, lpf.getOptions()).format() + "\n");

        out.write(LayerVectorCodec.format(lpf.getLayerType()));
        out.write(LayerVectorCodec.format(lpf.getLayerAvg()));
        out.write(LayerVectorCodec.format(lpf.getHorizAnisoFlag()));
        out.write(LayerVectorCodec.format(lpf.getVertCondFlag()));
        out.write(LayerVectorCodec.format(lpf.getWetFlag()));

        if (LpfLayout.hasWettingLine(lpf.getWetFlag())) {
            WettingControl wetting = lpf.getWettingControl();
            out.write(String.format(Locale.ROOT, "%10.6f%10d%10d\n",
                    wetting.wetFactor(), wetting.wetIterInterval(), wetting.wetEquationFlag()));
        }

        int nrow = model.getNrow();
        int ncol = model.getNcol();
        boolean storageCoefficient = lpf.hasOption(LpfOption.STORAGECOEFFICIENT);
        for (int k = 0; k < model.getNlay(); k++) {
            LpfLayout.LayerContext context = LpfLayout.context(k, lpf, model);
            for (LpfLayout.Step step : LpfLayout.STEPS) {
                if (!step.isPresent(context)) {
                    continue;
                }
                LpfField field = step.field();
                String label = LpfLayout.label(field, context, storageCoefficient);
                log.debug("Escribiendo {}", label);
                arrays.write(out, lpf.getField(field).getSlice(k), label, nrow, ncol);
            }
        }
        out.flush();
    }
}
