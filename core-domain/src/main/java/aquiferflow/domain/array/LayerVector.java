package aquiferflow.domain.array;

import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Vector de control con un valor por capa (LAYTYP, LAYAVG, CHANI, LAYVKA, LAYWET).
 * <p>
 * Admite la semántica de difusión: un array de longitud 1 rellena todas las capas.
 */
public final class LayerVector {

    @Getter
    private final String name;
    private final float[] values;
    @Getter
    private final boolean integral;

    private LayerVector(String name, float[] values, boolean integral) {
        this.name = name;
        this.values = values;
        this.integral = integral;
    }

    public static LayerVector ofInts(String name, int[] raw, int nlay) {
        Objects.requireNonNull(raw, "El vector '" + name + "' no puede ser nulo.");
        requireLength(name, raw.length, nlay);
        float[] values = new float[nlay];
        for (int k = 0; k < nlay; k++) {
            values[k] = raw.length == 1 ? raw[0] : raw[k];
        }
        return new LayerVector(name, values, true);
    }

    public static LayerVector ofFloats(String name, float[] raw, int nlay) {
        Objects.requireNonNull(raw, "El vector '" + name + "' no puede ser nulo.");
        requireLength(name, raw.length, nlay);
        float[] values = new float[nlay];
        for (int k = 0; k < nlay; k++) {
            values[k] = raw.length == 1 ? raw[0] : raw[k];
        }
        return new LayerVector(name, values, false);
    }

    private static void requireLength(String name, int length, int nlay) {
        if (length != 1 && length != nlay) {
            throw new IllegalArgumentException(String.format(
                    "El vector '%s' debe tener longitud 1 o %d (recibido %d).", name, nlay, length));
        }
    }

    public int size() {
        return values.length;
    }

    public int getInt(int layer) {
        return (int) values[layer];
    }

    public float getFloat(int layer) {
        return values[layer];
    }

    public double sum() {
        double total = 0.0;
        for (float v : values) {
            total += v;
        }
        return total;
    }

    public int[] toIntArray() {
        int[] copy = new int[values.length];
        for (int k = 0; k < values.length; k++) {
            copy[k] = (int) values[k];
        }
        return copy;
    }

    public float[] toFloatArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LayerVector)) return false;
        LayerVector other = (LayerVector) o;
        return integral == other.integral && name.equals(other.name) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(name, integral) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return name + (integral ? Arrays.toString(toIntArray()) : Arrays.toString(values));
    }
}
