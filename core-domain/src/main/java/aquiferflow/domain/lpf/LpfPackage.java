package aquiferflow.domain.lpf;

import aquiferflow.config.LpfConfig;
import aquiferflow.domain.array.FieldInput;
import aquiferflow.domain.array.LayerVector;
import aquiferflow.domain.array.LayeredField;
import aquiferflow.domain.grid.GridDimensions;
import aquiferflow.domain.model.GroundwaterModel;
import aquiferflow.domain.model.ModelPackage;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Paquete Layer Property Flow (LPF) de un modelo de flujo subterráneo en diferencias finitas.
 * <p>
 * Agrupa los escalares de cabecera, los cinco vectores de control por capa, los parámetros
 * de rehumectación y los siete campos 3-D de propiedades hidráulicas. La forma queda fijada
 * al construir y no cambia después.
 * <p>
 * Crear el paquete no tiene efectos secundarios: el registro en el modelo es una llamada
 * explícita a {@link GroundwaterModel#registerPackage(ModelPackage)}.
 */
public final class LpfPackage implements ModelPackage {

    public static final String PACKAGE_TYPE = "LPF";
    /** Unidad convencional para el balance celda a celda. */
    public static final int BUDGET_UNIT = 53;

    @Getter
    private final GridDimensions dimensions;
    @Getter
    private final int saveBudgetFlag;
    @Getter
    private final float dryHead;
    @Getter
    private final int parameterCount;
    private final Set<LpfOption> options;

    @Getter
    private final LayerVector layerType;
    @Getter
    private final LayerVector layerAvg;
    @Getter
    private final LayerVector horizAnisoFlag;
    @Getter
    private final LayerVector vertCondFlag;
    @Getter
    private final LayerVector wetFlag;

    @Getter
    private final WettingControl wettingControl;
    private final Map<LpfField, LayeredField> fields;

    @Getter
    private final int unitNumber;
    @Getter
    private final String extension;

    private LpfPackage(GridDimensions dimensions, LpfConfig config) {
        int nlay = dimensions.nlay();
        this.dimensions = dimensions;
        this.saveBudgetFlag = normalizeBudgetFlag(config.getSaveBudgetFlag());
        this.dryHead = config.getDryHead();
        this.parameterCount = config.getParameterCount();
        this.options = Collections.unmodifiableSet(config.options());

        this.layerType = LayerVector.ofInts("laytyp", config.getLayerType(), nlay);
        this.layerAvg = LayerVector.ofInts("layavg", config.getLayerAvg(), nlay);
        this.horizAnisoFlag = LayerVector.ofFloats("chani", config.getHorizAnisoFlag(), nlay);
        this.vertCondFlag = LayerVector.ofInts("layvka", config.getVertCondFlag(), nlay);
        this.wetFlag = LayerVector.ofInts("laywet", config.getWetFlag(), nlay);

        this.wettingControl = new WettingControl(config.getWetFactor(), config.getWetIterInterval(),
                config.getWetEquationFlag());

        boolean storageCoefficient = options.contains(LpfOption.STORAGECOEFFICIENT);
        Map<LpfField, LayeredField> resolved = new EnumMap<>(LpfField.class);
        for (LpfField field : LpfField.values()) {
            List<String> layerNames = new ArrayList<>(nlay);
            for (int k = 0; k < nlay; k++) {
                layerNames.add(field.resolveTag(vertCondFlag.getInt(k), storageCoefficient));
            }
            LayeredField layered = Objects.requireNonNull(config.inputFor(field),
                    "El campo " + field.getBaseName() + " no puede ser nulo.")
                    .resolve(field.resolveTag(0, storageCoefficient), layerNames,
                            dimensions.nrow(), dimensions.ncol());
            resolved.put(field, layered);
        }
        this.fields = Collections.unmodifiableMap(resolved);

        this.unitNumber = config.getUnitNumber();
        this.extension = Objects.requireNonNull(config.getExtension(), "La extensión no puede ser nula.");
    }

    /**
     * Construye y normaliza el paquete para la malla del modelo.
     *
     * @throws IllegalArgumentException si algún vector o campo no encaja en la malla.
     */
    public static LpfPackage create(GroundwaterModel model, LpfConfig config) {
        Objects.requireNonNull(model, "El modelo no puede ser nulo.");
        return create(model.getDimensions(), config);
    }

    public static LpfPackage create(GridDimensions dimensions, LpfConfig config) {
        Objects.requireNonNull(dimensions, "Las dimensiones no pueden ser nulas.");
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        return new LpfPackage(dimensions, config);
    }

    /**
     * Comprueba que el paquete se construyó para la malla del modelo.
     *
     * @throws IllegalArgumentException si las dimensiones no coinciden.
     */
    public void requireSameGrid(GroundwaterModel model) {
        Objects.requireNonNull(model, "El modelo no puede ser nulo.");
        if (!dimensions.equals(model.getDimensions())) {
            throw new IllegalArgumentException(String.format(
                    "El paquete (%s) no corresponde a la malla del modelo (%s).", dimensions, model.getDimensions()));
        }
    }

    /**
     * Cualquier valor distinto de cero se normaliza a {@link #BUDGET_UNIT}.
     */
    public static int normalizeBudgetFlag(int flag) {
        return flag != 0 ? BUDGET_UNIT : 0;
    }

    @Override
    public String getPackageType() {
        return PACKAGE_TYPE;
    }

    public int getLayerCount() {
        return dimensions.nlay();
    }

    public Set<LpfOption> getOptions() {
        return options;
    }

    public boolean hasOption(LpfOption option) {
        return options.contains(option);
    }

    /**
     * Opciones activas como tokens separados por espacios, en orden canónico.
     */
    public String getOptionsString() {
        return options.stream().map(Enum::name).collect(Collectors.joining(" "));
    }

    /**
     * La rehumectación está activa si la suma de LAYWET es positiva.
     */
    public boolean isWettingActive() {
        return wetFlag.sum() > 0;
    }

    public LayeredField getField(LpfField field) {
        return fields.get(field);
    }

    public LayeredField getHorizCond() {
        return fields.get(LpfField.HORIZONTAL_CONDUCTIVITY);
    }

    public LayeredField getHorizAnisoArray() {
        return fields.get(LpfField.HORIZONTAL_ANISOTROPY);
    }

    public LayeredField getVertCond() {
        return fields.get(LpfField.VERTICAL_CONDUCTIVITY);
    }

    public LayeredField getSpecificStorage() {
        return fields.get(LpfField.SPECIFIC_STORAGE);
    }

    public LayeredField getSpecificYield() {
        return fields.get(LpfField.SPECIFIC_YIELD);
    }

    public LayeredField getConfiningBedCond() {
        return fields.get(LpfField.CONFINING_BED_CONDUCTIVITY);
    }

    public LayeredField getWetDryParams() {
        return fields.get(LpfField.WET_DRY);
    }

    /**
     * Devuelve una configuración equivalente a este paquete, útil para derivar variantes
     * con {@code with...}.
     */
    public LpfConfig toConfig() {
        return LpfConfig.builder()
                .saveBudgetFlag(saveBudgetFlag)
                .dryHead(dryHead)
                .parameterCount(parameterCount)
                .layerType(layerType.toIntArray())
                .layerAvg(layerAvg.toIntArray())
                .horizAnisoFlag(horizAnisoFlag.toFloatArray())
                .vertCondFlag(vertCondFlag.toIntArray())
                .wetFlag(wetFlag.toIntArray())
                .wetFactor(wettingControl.wetFactor())
                .wetIterInterval(wettingControl.wetIterInterval())
                .wetEquationFlag(wettingControl.wetEquationFlag())
                .horizCond(FieldInput.layers(getHorizCond().getSlices()))
                .horizAnisoArray(FieldInput.layers(getHorizAnisoArray().getSlices()))
                .vertCond(FieldInput.layers(getVertCond().getSlices()))
                .specificStorage(FieldInput.layers(getSpecificStorage().getSlices()))
                .specificYield(FieldInput.layers(getSpecificYield().getSlices()))
                .confiningBedCond(FieldInput.layers(getConfiningBedCond().getSlices()))
                .wetDryParams(FieldInput.layers(getWetDryParams().getSlices()))
                .storageCoefficient(options.contains(LpfOption.STORAGECOEFFICIENT))
                .constantCv(options.contains(LpfOption.CONSTANTCV))
                .thickStrt(options.contains(LpfOption.THICKSTRT))
                .noCvCorrection(options.contains(LpfOption.NOCVCORRECTION))
                .noVfc(options.contains(LpfOption.NOVFC))
                .unitNumber(unitNumber)
                .extension(extension)
                .build();
    }

    @Override
    public String toString() {
        return "LpfPackage[" + dimensions + ", ipakcb=" + saveBudgetFlag + ", hdry=" + dryHead
                + ", nplpf=" + parameterCount + ", options=" + options + "]";
    }
}
