package aquiferflow.io.param;

import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.domain.model.GroundwaterModel;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Parámetros cargados de un paquete: los tipos definidos y la función que rellena una capa
 * a partir de ellos.
 */
public final class ParameterSet {

    public static final ParameterSet EMPTY = new ParameterSet(List.of(), null);

    private final List<ParameterDefinition> definitions;
    private final Set<String> types;
    private final GroundwaterModel model;

    public ParameterSet(List<ParameterDefinition> definitions, GroundwaterModel model) {
        this.definitions = List.copyOf(definitions);
        Set<String> collected = new LinkedHashSet<>();
        for (ParameterDefinition definition : this.definitions) {
            collected.add(definition.type());
        }
        this.types = Collections.unmodifiableSet(collected);
        this.model = model;
    }

    public List<ParameterDefinition> getDefinitions() {
        return definitions;
    }

    public Set<String> getTypes() {
        return types;
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    public boolean contains(String type) {
        return types.contains(type.toLowerCase(Locale.ROOT));
    }

    /**
     * Primer tipo de la lista que está definido en este conjunto.
     */
    public Optional<String> firstDefined(List<String> candidates) {
        for (String candidate : candidates) {
            if (contains(candidate)) {
                return Optional.of(candidate.toLowerCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    /**
     * Rellena una capa sumando la contribución de cada parámetro del tipo pedido:
     * {@code valor * multiplicador}, limitado a las zonas del cluster. El valor es el que
     * fija el modelo para el parámetro, si lo hay, o el definido en el paquete.
     *
     * @param type  Tipo de parámetro.
     * @param layer Capa en base 0.
     * @throws PackageFormatException si un cluster usa un array que el modelo no define.
     */
    public float[][] fill(String type, int layer, int nrow, int ncol) throws PackageFormatException {
        float[][] data = new float[nrow][ncol];
        String wanted = type.toLowerCase(Locale.ROOT);
        for (ParameterDefinition definition : definitions) {
            if (!definition.type().equals(wanted)) {
                continue;
            }
            float pv = model != null
                    ? model.getParameterValue(definition.name()).orElse(definition.value())
                    : definition.value();
            for (ParameterCluster cluster : definition.clusters()) {
                if (cluster.layer() != layer + 1) {
                    continue;
                }
                float[][] mult = multiplier(cluster, definition, nrow, ncol);
                int[][] zone = cluster.usesZones() ? zone(cluster, definition, nrow, ncol) : null;
                for (int i = 0; i < nrow; i++) {
                    for (int j = 0; j < ncol; j++) {
                        if (zone == null || cluster.zones().contains(zone[i][j])) {
                            data[i][j] += pv * mult[i][j];
                        }
                    }
                }
            }
        }
        return data;
    }

    private float[][] multiplier(ParameterCluster cluster, ParameterDefinition definition, int nrow, int ncol)
            throws PackageFormatException {
        if (!cluster.usesMultiplier()) {
            float[][] ones = new float[nrow][ncol];
            for (float[] row : ones) {
                Arrays.fill(row, 1.0f);
            }
            return ones;
        }
        float[][] mult = lookup(model == null ? Optional.empty() : model.getMultiplierArray(cluster.multiplierArray()),
                "multiplicador", cluster.multiplierArray(), definition);
        if (mult.length != nrow || mult[0].length != ncol) {
            throw new PackageFormatException(String.format(
                    "El array multiplicador '%s' no tiene forma %dx%d", cluster.multiplierArray(), nrow, ncol));
        }
        return mult;
    }

    private int[][] zone(ParameterCluster cluster, ParameterDefinition definition, int nrow, int ncol)
            throws PackageFormatException {
        int[][] zone = lookup(model == null ? Optional.empty() : model.getZoneArray(cluster.zoneArray()),
                "de zonas", cluster.zoneArray(), definition);
        if (zone.length != nrow || zone[0].length != ncol) {
            throw new PackageFormatException(String.format(
                    "El array de zonas '%s' no tiene forma %dx%d", cluster.zoneArray(), nrow, ncol));
        }
        return zone;
    }

    private static <T> T lookup(Optional<T> found, String kind, String arrayName, ParameterDefinition definition)
            throws PackageFormatException {
        if (found.isEmpty()) {
            throw new PackageFormatException(String.format(
                    "El parámetro '%s' usa el array %s '%s', que no está definido en el modelo",
                    definition.name(), kind, arrayName));
        }
        return found.get();
    }
}
