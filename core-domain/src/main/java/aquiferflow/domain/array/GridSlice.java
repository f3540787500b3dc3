package aquiferflow.domain.array;

import java.util.Arrays;
import java.util.Objects;

/**
 * Capa con un valor distinto por celda, almacenada en orden fila-columna.
 * <p>
 * Los datos se clonan al construir y al consultar, de modo que la instancia es inmutable.
 */
public record GridSlice(float[][] values) implements LayerSlice {

    public GridSlice {
        Objects.requireNonNull(values, "La malla de valores no puede ser nula.");
        values = LayerSlice.copyOf(values);
    }

    @Override
    public float[][] values() {
        return LayerSlice.copyOf(values);
    }

    @Override
    public float[][] toArray(int nrow, int ncol) {
        requireShape(nrow, ncol);
        return LayerSlice.copyOf(values);
    }

    @Override
    public void requireShape(int nrow, int ncol) {
        LayerSlice.checkShape(values, nrow, ncol, "GridSlice");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridSlice)) return false;
        return Arrays.deepEquals(values, ((GridSlice) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "GridSlice[" + values.length + "x" + (values.length == 0 ? 0 : values[0].length) + "]";
    }
}
