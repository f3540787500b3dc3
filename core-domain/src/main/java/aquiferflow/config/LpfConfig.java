package aquiferflow.config;

import aquiferflow.domain.array.FieldInput;
import aquiferflow.domain.lpf.LpfField;
import aquiferflow.domain.lpf.LpfOption;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.EnumSet;
import java.util.Set;

/**
 * Valores de entrada del paquete LPF antes de normalizar.
 * <p>
 * Los vectores por capa admiten longitud 1 (se difunden a todas las capas) o {@code nlay}.
 * Los campos 3-D se expresan como {@link FieldInput}. Los valores por defecto son los
 * habituales de MODFLOW-2005.
 */
@Value
@Builder(toBuilder = true)
@With
public class LpfConfig {

    /** Unidad por defecto del archivo del paquete. */
    public static final int DEFAULT_UNIT_NUMBER = 15;

    /** IPAKCB: distinto de cero activa el guardado del balance celda a celda. */
    @Builder.Default
    int saveBudgetFlag = 53;
    /** HDRY: carga asignada a las celdas que se secan. */
    @Builder.Default
    float dryHead = -1.0e30f;
    /** NPLPF: número de parámetros del paquete. */
    @Builder.Default
    int parameterCount = 0;

    @Builder.Default
    int[] layerType = {0};
    @Builder.Default
    int[] layerAvg = {0};
    @Builder.Default
    float[] horizAnisoFlag = {1.0f};
    @Builder.Default
    int[] vertCondFlag = {0};
    @Builder.Default
    int[] wetFlag = {0};

    @Builder.Default
    float wetFactor = 0.1f;
    @Builder.Default
    int wetIterInterval = 1;
    @Builder.Default
    int wetEquationFlag = 0;

    @Builder.Default
    FieldInput horizCond = FieldInput.uniform(1.0f);
    @Builder.Default
    FieldInput horizAnisoArray = FieldInput.uniform(1.0f);
    @Builder.Default
    FieldInput vertCond = FieldInput.uniform(1.0f);
    @Builder.Default
    FieldInput specificStorage = FieldInput.uniform(1.0e-5f);
    @Builder.Default
    FieldInput specificYield = FieldInput.uniform(0.15f);
    @Builder.Default
    FieldInput confiningBedCond = FieldInput.uniform(0.0f);
    @Builder.Default
    FieldInput wetDryParams = FieldInput.uniform(-0.01f);

    boolean storageCoefficient;
    boolean constantCv;
    boolean thickStrt;
    boolean noCvCorrection;
    boolean noVfc;

    @Builder.Default
    int unitNumber = DEFAULT_UNIT_NUMBER;
    @Builder.Default
    String extension = "lpf";

    public static LpfConfig defaults() {
        return LpfConfig.builder().build();
    }

    public FieldInput inputFor(LpfField field) {
        switch (field) {
            case HORIZONTAL_CONDUCTIVITY:
                return horizCond;
            case HORIZONTAL_ANISOTROPY:
                return horizAnisoArray;
            case VERTICAL_CONDUCTIVITY:
                return vertCond;
            case SPECIFIC_STORAGE:
                return specificStorage;
            case SPECIFIC_YIELD:
                return specificYield;
            case CONFINING_BED_CONDUCTIVITY:
                return confiningBedCond;
            case WET_DRY:
                return wetDryParams;
            default:
                throw new IllegalStateException("Campo LPF desconocido: " + field);
        }
    }

    /**
     * Opciones activas, en orden canónico.
     */
    public Set<LpfOption> options() {
        Set<LpfOption> options = EnumSet.noneOf(LpfOption.class);
        if (storageCoefficient) options.add(LpfOption.STORAGECOEFFICIENT);
        if (constantCv) options.add(LpfOption.CONSTANTCV);
        if (thickStrt) options.add(LpfOption.THICKSTRT);
        if (noCvCorrection) options.add(LpfOption.NOCVCORRECTION);
        if (noVfc) options.add(LpfOption.NOVFC);
        return options;
    }
}
