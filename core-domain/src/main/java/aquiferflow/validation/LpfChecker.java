package aquiferflow.validation;

import aquiferflow.domain.array.LayeredField;
import aquiferflow.domain.lpf.LpfPackage;
import aquiferflow.domain.model.GroundwaterModel;
import aquiferflow.utils.NumberFormats;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Validación de rangos físicos del paquete LPF.
 * <p>
 * Las celdas inactivas del modelo quedan fuera de las comprobaciones, y las capas en las
 * que un campo no se usa se fuerzan a un valor neutro antes de evaluar. Ambas sustituciones
 * se hacen sobre copias: los campos del paquete nunca se modifican.
 * <p>
 * Los errores de datos no lanzan excepciones; se acumulan en el {@link CheckReport}.
 */
@Slf4j
public class LpfChecker {

    private static final float NEUTRAL = 1.0f;

    /**
     * Condición de error de un campo sobre un valor de celda.
     */
    private enum Bound {
        NEGATIVE {
            @Override
            boolean fails(float v) {
                return v < 0.0f;
            }
        },
        NON_POSITIVE {
            @Override
            boolean fails(float v) {
                return v <= 0.0f;
            }
        };

        abstract boolean fails(float v);
    }

    /**
     * Valida el paquete contra la máscara de celdas activas del modelo.
     *
     * @throws IllegalArgumentException si el paquete no corresponde a la malla del modelo.
     */
    public CheckReport check(LpfPackage lpf, GroundwaterModel model, CheckLevel level) {
        Objects.requireNonNull(lpf, "El paquete no puede ser nulo.");
        lpf.requireSameGrid(model);
        String name = lpf.getPackageType();
        Accumulator acc = new Accumulator(model, level);

        acc.checkField(lpf.getHorizCond(), 0.0f, k -> false, Bound.NEGATIVE, true,
                "Negative horizontal hydraulic conductivity",
                "horizontal hydraulic conductivity");

        acc.checkField(lpf.getHorizAnisoArray(), 0.0f, k -> lpf.getHorizAnisoFlag().getFloat(k) > 0, Bound.NEGATIVE,
                false,
                "Negative horizontal hydraulic conductivity ratio",
                "horizontal hydraulic conductivity ratio");

        acc.checkField(lpf.getVertCond(), NEUTRAL, k -> false, Bound.NON_POSITIVE, true,
                "Negative or zero vertical hydraulic conductivity",
                "vertical hydraulic conductivity");

        acc.checkField(lpf.getConfiningBedCond(), NEUTRAL, k -> model.getConfiningBedFlag(k) <= 0, Bound.NEGATIVE,
                false,
                "Negative quasi-3D confining bed vertical hydraulic conductivity",
                "quasi-3D confining bed vertical hydraulic conductivity");

        if (model.isTransient()) {
            acc.checkField(lpf.getSpecificStorage(), NEUTRAL, k -> false, Bound.NEGATIVE, true,
                    "Negative specific storage",
                    "specific storage");
            acc.checkField(lpf.getSpecificYield(), NEUTRAL, k -> lpf.getLayerType().getInt(k) == 0, Bound.NEGATIVE,
                    false,
                    "Negative specific yield",
                    "specific yield");
        }

        StringBuilder text = new StringBuilder();
        text.append('\n').append(name).append(" PACKAGE DATA VALIDATION:\n");
        text.append(acc.summary);
        if (level == CheckLevel.DETAILED && acc.errors) {
            text.append("\n  DETAILED SUMMARY OF ").append(name).append(" ERRORS:\n");
            text.append(acc.detail);
        }

        if (acc.errors) {
            log.warn("La validación del paquete {} ha encontrado {} celdas fuera de rango.", name, acc.issues.size());
        } else {
            log.debug("La validación del paquete {} no ha encontrado errores.", name);
        }
        return new CheckReport(name, level, text.toString(), acc.errors, acc.issues);
    }

    /**
     * Valida y, opcionalmente, guarda el informe y lo muestra por la salida indicada.
     *
     * @param destination Archivo del informe, o {@code null} para no escribirlo.
     * @param echo        Salida para mostrar el informe, o {@code null}.
     * @throws IOException si no se puede escribir el informe.
     */
    public CheckReport check(LpfPackage lpf, GroundwaterModel model, CheckLevel level, Path destination,
                             PrintStream echo) throws IOException {
        CheckReport report = check(lpf, model, level);
        if (destination != null) {
            report.writeTo(destination);
        }
        if (echo != null) {
            report.echoTo(echo);
        }
        return report;
    }

    private static final class Accumulator {
        private final GroundwaterModel model;
        private final CheckLevel level;
        private final StringBuilder summary = new StringBuilder();
        private final StringBuilder detail = new StringBuilder();
        private final List<CellIssue> issues = new ArrayList<>();
        private boolean errors;

        Accumulator(GroundwaterModel model, CheckLevel level) {
            this.model = model;
            this.level = level;
        }

        /**
         * @param field          Campo a comprobar.
         * @param inactiveValue  Valor asignado a las celdas inactivas antes de evaluar.
         * @param excludedLayer  Capas en las que el campo no se usa; se fuerzan a 1.
         * @param bound          Condición de error.
         * @param alwaysReportOk Si es falso, la línea "OK" solo aparece cuando alguna capa usa el campo.
         */
        void checkField(LayeredField field, float inactiveValue, IntPredicate excludedLayer, Bound bound,
                        boolean alwaysReportOk, String errorCondition, String description) {
            float[][][] data = field.toArray();
            boolean useArray = false;
            for (int k = 0; k < data.length; k++) {
                if (excludedLayer.test(k)) {
                    for (float[] row : data[k]) {
                        Arrays.fill(row, NEUTRAL);
                    }
                    continue;
                }
                useArray = true;
                for (int i = 0; i < data[k].length; i++) {
                    for (int j = 0; j < data[k][i].length; j++) {
                        if (!model.isActive(k, i, j)) {
                            data[k][i][j] = inactiveValue;
                        }
                    }
                }
            }

            boolean fieldFailed = false;
            int headerLayer = -1;
            for (int k = 0; k < data.length; k++) {
                for (int i = 0; i < data[k].length; i++) {
                    for (int j = 0; j < data[k][i].length; j++) {
                        float v = data[k][i][j];
                        if (!bound.fails(v)) {
                            continue;
                        }
                        fieldFailed = true;
                        String layerName = field.getLayerName(k);
                        issues.add(new CellIssue(layerName, k, i, j, v));
                        if (level == CheckLevel.DETAILED) {
                            if (k > headerLayer) {
                                headerLayer = k;
                                detail.append(String.format(Locale.ROOT, "    %10s%10s%10s%15s\n",
                                        "layer", "row", "column", layerName));
                            }
                            detail.append(String.format(Locale.ROOT, "    %10d%10d%10d", k + 1, i + 1, j + 1))
                                    .append(NumberFormats.general(v, 15, 7, false))
                                    .append('\n');
                        }
                    }
                }
            }

            if (fieldFailed) {
                errors = true;
                summary.append("  ERROR: ").append(errorCondition).append(" specified.\n");
            } else if (alwaysReportOk || useArray) {
                summary.append("  Specified ").append(description).append(" is OK.\n");
            }
        }
    }
}
