package aquiferflow.domain.array;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Valor de entrada de un campo 3-D antes de conocer la malla.
 * <p>
 * Un escalar se difunde a todas las capas y celdas; una malla completa debe tener forma
 * {@code (nlay, nrow, ncol)}; una lista de capas debe tener longitud 1 o {@code nlay}.
 */
public final class FieldInput {

    private final Float uniform;
    private final float[][][] grid;
    private final List<LayerSlice> layers;

    private FieldInput(Float uniform, float[][][] grid, List<LayerSlice> layers) {
        this.uniform = uniform;
        this.grid = grid;
        this.layers = layers;
    }

    public static FieldInput uniform(float value) {
        return new FieldInput(value, null, null);
    }

    public static FieldInput grid(float[][][] values) {
        Objects.requireNonNull(values, "La malla de entrada no puede ser nula.");
        return new FieldInput(null, values, null);
    }

    public static FieldInput layers(List<? extends LayerSlice> slices) {
        Objects.requireNonNull(slices, "Las capas de entrada no pueden ser nulas.");
        return new FieldInput(null, null, List.copyOf(slices));
    }

    public static FieldInput layers(LayerSlice... slices) {
        return layers(List.of(slices));
    }

    /**
     * Resuelve la entrada contra las dimensiones de la malla.
     *
     * @param name       Nombre base del campo.
     * @param layerNames Etiqueta resuelta de cada capa; su longitud fija {@code nlay}.
     * @throws IllegalArgumentException si la forma de la entrada no es compatible.
     */
    public LayeredField resolve(String name, List<String> layerNames, int nrow, int ncol) {
        int nlay = layerNames.size();
        List<LayerSlice> slices = new ArrayList<>(nlay);
        if (uniform != null) {
            for (int k = 0; k < nlay; k++) {
                slices.add(new UniformSlice(uniform));
            }
        } else if (grid != null) {
            if (grid.length != nlay) {
                throw new IllegalArgumentException(String.format(
                        "Campo '%s': se esperaban %d capas y se recibieron %d.", name, nlay, grid.length));
            }
            for (float[][] layer : grid) {
                LayerSlice.checkShape(layer, nrow, ncol, "Campo '" + name + "'");
                slices.add(new GridSlice(layer));
            }
        } else {
            if (layers.size() != 1 && layers.size() != nlay) {
                throw new IllegalArgumentException(String.format(
                        "Campo '%s': la lista de capas debe tener longitud 1 o %d (recibido %d).",
                        name, nlay, layers.size()));
            }
            for (int k = 0; k < nlay; k++) {
                slices.add(layers.size() == 1 ? layers.get(0) : layers.get(k));
            }
        }
        return new LayeredField(name, nrow, ncol, slices, layerNames);
    }
}
