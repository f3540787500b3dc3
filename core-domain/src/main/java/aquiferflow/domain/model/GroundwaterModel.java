package aquiferflow.domain.model;

import aquiferflow.domain.grid.GridDimensions;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Modelo propietario de los paquetes.
 * <p>
 * Proporciona, en solo lectura, las dimensiones de la malla, el estado estacionario de los
 * periodos de estrés, los indicadores de lecho confinante por capa y la máscara de celdas
 * activas. Además mantiene el registro de paquetes (uno por tipo), el conjunto de unidades
 * consumidas y los arrays multiplicadores y de zonas que usan los parámetros.
 */
@Slf4j
public class GroundwaterModel {

    @Getter
    private final String name;
    @Getter
    private final Path workspace;
    @Getter
    private final GridDimensions dimensions;
    @Getter
    private final boolean verbose;

    private final boolean[] steady;
    private final int[] laycbd;
    private final int[][][] ibound;

    private final Map<String, float[][]> multiplierArrays;
    private final Map<String, int[][]> zoneArrays;
    private final Map<String, Float> parameterValues;

    private final Map<String, ModelPackage> packages = new LinkedHashMap<>();
    private final Set<Integer> consumedUnits = new LinkedHashSet<>();

    /**
     * @param name             Nombre del modelo, base de los nombres de archivo.
     * @param workspace        Directorio de trabajo. Por defecto el directorio actual.
     * @param dimensions       Dimensiones de la malla.
     * @param steady           Estado estacionario de cada periodo (longitud nper). Por defecto todos estacionarios.
     * @param laycbd           Indicador de lecho confinante bajo cada capa (longitud nlay). Por defecto ceros.
     * @param ibound           Máscara de celdas (0 = inactiva). Nula si todas están activas.
     * @param verbose          Muestra los informes de validación por la salida estándar.
     * @param multiplierArrays Arrays multiplicadores por nombre.
     * @param zoneArrays       Arrays de zonas por nombre.
     * @param parameterValues  Valores de parámetro que sustituyen a los definidos en los paquetes.
     */
    @Builder
    public GroundwaterModel(String name,
                            Path workspace,
                            GridDimensions dimensions,
                            boolean[] steady,
                            int[] laycbd,
                            int[][][] ibound,
                            boolean verbose,
                            @Singular Map<String, float[][]> multiplierArrays,
                            @Singular Map<String, int[][]> zoneArrays,
                            @Singular Map<String, Float> parameterValues) {
        this.dimensions = Objects.requireNonNull(dimensions, "Las dimensiones del modelo no pueden ser nulas.");
        this.name = name != null ? name : "modflowtest";
        this.workspace = workspace != null ? workspace : Paths.get(".");
        this.verbose = verbose;

        if (steady == null) {
            this.steady = new boolean[dimensions.nper()];
            Arrays.fill(this.steady, true);
        } else if (steady.length != dimensions.nper()) {
            throw new IllegalArgumentException(String.format(
                    "El array 'steady' debe tener longitud nper=%d (recibido %d).", dimensions.nper(), steady.length));
        } else {
            this.steady = steady.clone();
        }

        if (laycbd == null) {
            this.laycbd = new int[dimensions.nlay()];
        } else if (laycbd.length != dimensions.nlay()) {
            throw new IllegalArgumentException(String.format(
                    "El array 'laycbd' debe tener longitud nlay=%d (recibido %d).", dimensions.nlay(), laycbd.length));
        } else {
            this.laycbd = laycbd.clone();
        }

        if (ibound != null) {
            checkIbound(ibound, dimensions);
            this.ibound = new int[ibound.length][][];
            for (int k = 0; k < ibound.length; k++) {
                this.ibound[k] = new int[ibound[k].length][];
                for (int i = 0; i < ibound[k].length; i++) {
                    this.ibound[k][i] = ibound[k][i].clone();
                }
            }
        } else {
            this.ibound = null;
        }

        this.multiplierArrays = lowerCaseKeys(multiplierArrays);
        this.zoneArrays = lowerCaseKeys(zoneArrays);
        this.parameterValues = lowerCaseKeys(parameterValues);
    }

    private static void checkIbound(int[][][] ibound, GridDimensions dims) {
        boolean ok = ibound.length == dims.nlay();
        for (int k = 0; ok && k < ibound.length; k++) {
            ok = ibound[k].length == dims.nrow();
            for (int i = 0; ok && i < ibound[k].length; i++) {
                ok = ibound[k][i].length == dims.ncol();
            }
        }
        if (!ok) {
            throw new IllegalArgumentException("La máscara 'ibound' no coincide con las dimensiones " + dims + ".");
        }
    }

    private static <V> Map<String, V> lowerCaseKeys(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, V> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key.toLowerCase(Locale.ROOT), value));
        return Collections.unmodifiableMap(copy);
    }

    // --- CONSULTAS DE MALLA ---

    public int getNrow() {
        return dimensions.nrow();
    }

    public int getNcol() {
        return dimensions.ncol();
    }

    public int getNlay() {
        return dimensions.nlay();
    }

    public int getNper() {
        return dimensions.nper();
    }

    /**
     * El modelo es transitorio si algún periodo de estrés no es estacionario.
     */
    public boolean isTransient() {
        for (boolean s : steady) {
            if (!s) {
                return true;
            }
        }
        return false;
    }

    public int getConfiningBedFlag(int layer) {
        return laycbd[layer];
    }

    public boolean[] getSteadyFlags() {
        return steady.clone();
    }

    public int[] getConfiningBedFlags() {
        return laycbd.clone();
    }

    public boolean hasActiveMask() {
        return ibound != null;
    }

    public boolean isActive(int layer, int row, int column) {
        return ibound == null || ibound[layer][row][column] != 0;
    }

    /**
     * Máscara de celdas activas. La matriz devuelta es una copia.
     */
    public boolean[][][] getActiveMask() {
        boolean[][][] mask = new boolean[getNlay()][getNrow()][getNcol()];
        for (int k = 0; k < getNlay(); k++) {
            for (int i = 0; i < getNrow(); i++) {
                for (int j = 0; j < getNcol(); j++) {
                    mask[k][i][j] = isActive(k, i, j);
                }
            }
        }
        return mask;
    }

    // --- REGISTRO DE PAQUETES ---

    /**
     * Añade un paquete al modelo. Solo se admite un paquete por tipo.
     *
     * @return {@link RegistrationResult#DUPLICATE} si ya existía uno del mismo tipo;
     * en ese caso el registro no cambia.
     */
    public RegistrationResult registerPackage(ModelPackage modelPackage) {
        String type = modelPackage.getPackageType().toUpperCase(Locale.ROOT);
        if (packages.containsKey(type)) {
            log.warn("El modelo '{}' ya contiene un paquete {}. Se ignora el nuevo.", name, type);
            return RegistrationResult.DUPLICATE;
        }
        packages.put(type, modelPackage);
        log.debug("Paquete {} registrado en el modelo '{}' (unidad {}).", type, name, modelPackage.getUnitNumber());
        return RegistrationResult.REGISTERED;
    }

    public Optional<ModelPackage> getPackage(String packageType) {
        return Optional.ofNullable(packages.get(packageType.toUpperCase(Locale.ROOT)));
    }

    public void addConsumedUnit(int unitNumber) {
        consumedUnits.add(unitNumber);
    }

    public Set<Integer> getConsumedUnits() {
        return Collections.unmodifiableSet(consumedUnits);
    }

    // --- ARRAYS DE PARÁMETROS ---

    public Optional<float[][]> getMultiplierArray(String arrayName) {
        return Optional.ofNullable(multiplierArrays.get(arrayName.toLowerCase(Locale.ROOT)));
    }

    public Optional<int[][]> getZoneArray(String arrayName) {
        return Optional.ofNullable(zoneArrays.get(arrayName.toLowerCase(Locale.ROOT)));
    }

    public Optional<Float> getParameterValue(String parameterName) {
        return Optional.ofNullable(parameterValues.get(parameterName.toLowerCase(Locale.ROOT)));
    }

    /**
     * Ruta por defecto de un archivo del modelo: {@code <workspace>/<name>.<extension>}.
     */
    public Path resolveFile(String extension) {
        return workspace.resolve(name + "." + extension);
    }

    @Override
    public String toString() {
        return "GroundwaterModel[" + name + ", " + dimensions + ", transient=" + isTransient() + "]";
    }
}
