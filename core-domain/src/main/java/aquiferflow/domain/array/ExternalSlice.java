package aquiferflow.domain.array;

import java.util.Arrays;
import java.util.Objects;

/**
 * Capa cuyos valores residen en un archivo externo.
 * <p>
 * Se conservan la ubicación, el multiplicador y los valores sin escalar tal y como
 * aparecen en el archivo, para poder reescribir la misma directiva.
 *
 * @param location   Ruta del archivo de datos, tal y como aparece en la directiva.
 * @param multiplier Multiplicador de la directiva. Cero significa "sin escalar".
 * @param values     Valores crudos del archivo.
 */
public record ExternalSlice(String location, float multiplier, float[][] values) implements LayerSlice {

    public ExternalSlice {
        Objects.requireNonNull(location, "La ubicación del archivo externo no puede ser nula.");
        Objects.requireNonNull(values, "Los valores del archivo externo no pueden ser nulos.");
        if (location.isBlank()) {
            throw new IllegalArgumentException("La ubicación del archivo externo no puede estar vacía.");
        }
        values = LayerSlice.copyOf(values);
    }

    @Override
    public float[][] values() {
        return LayerSlice.copyOf(values);
    }

    @Override
    public float[][] toArray(int nrow, int ncol) {
        requireShape(nrow, ncol);
        float[][] data = LayerSlice.copyOf(values);
        if (multiplier != 0.0f) {
            for (float[] row : data) {
                for (int j = 0; j < row.length; j++) {
                    row[j] *= multiplier;
                }
            }
        }
        return data;
    }

    @Override
    public void requireShape(int nrow, int ncol) {
        LayerSlice.checkShape(values, nrow, ncol, "ExternalSlice(" + location + ")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExternalSlice)) return false;
        ExternalSlice other = (ExternalSlice) o;
        return location.equals(other.location)
                && Float.compare(multiplier, other.multiplier) == 0
                && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(location, multiplier) + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "ExternalSlice[" + location + ", x" + multiplier + "]";
    }
}
