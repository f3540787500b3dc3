package aquiferflow.domain.array;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Campo de propiedades de forma {@code (nlay, nrow, ncol)} compuesto por una
 * {@link LayerSlice} por capa.
 * <p>
 * Cada capa lleva su propia etiqueta resuelta (por ejemplo {@code vka} o {@code vani}),
 * que es la que se usa al escribir el bloque de la capa. La forma queda fijada al construir.
 */
public final class LayeredField {

    @Getter
    private final String name;
    @Getter
    private final int nrow;
    @Getter
    private final int ncol;
    private final List<LayerSlice> slices;
    private final List<String> layerNames;

    public LayeredField(String name, int nrow, int ncol, List<LayerSlice> slices, List<String> layerNames) {
        Objects.requireNonNull(name, "El nombre del campo no puede ser nulo.");
        Objects.requireNonNull(slices, "Las capas del campo no pueden ser nulas.");
        Objects.requireNonNull(layerNames, "Los nombres de capa no pueden ser nulos.");
        if (slices.size() != layerNames.size()) {
            throw new IllegalArgumentException(String.format(
                    "Campo '%s': %d capas pero %d nombres de capa.", name, slices.size(), layerNames.size()));
        }
        for (int k = 0; k < slices.size(); k++) {
            LayerSlice slice = Objects.requireNonNull(slices.get(k),
                    "Campo '" + name + "': la capa " + (k + 1) + " es nula.");
            slice.requireShape(nrow, ncol);
        }
        this.name = name;
        this.nrow = nrow;
        this.ncol = ncol;
        this.slices = List.copyOf(slices);
        this.layerNames = List.copyOf(layerNames);
    }

    public int getLayerCount() {
        return slices.size();
    }

    public LayerSlice getSlice(int layer) {
        return slices.get(layer);
    }

    public List<LayerSlice> getSlices() {
        return slices;
    }

    /**
     * Etiqueta resuelta de la capa, usada en los bloques de texto y en los informes.
     */
    public String getLayerName(int layer) {
        return layerNames.get(layer);
    }

    public List<String> getLayerNames() {
        return layerNames;
    }

    public float[][] layerArray(int layer) {
        return slices.get(layer).toArray(nrow, ncol);
    }

    /**
     * Materializa el campo completo en una matriz nueva.
     */
    public float[][][] toArray() {
        float[][][] data = new float[slices.size()][][];
        for (int k = 0; k < slices.size(); k++) {
            data[k] = layerArray(k);
        }
        return data;
    }

    @Override
    public String toString() {
        return "LayeredField[" + name + ", " + slices.size() + "x" + nrow + "x" + ncol + "]";
    }
}
