package aquiferflow.domain.array;

/**
 * Valor de un campo 3-D para una única capa.
 * <p>
 * Cada capa es, de forma independiente, un escalar uniforme ({@link UniformSlice}),
 * una malla completa ({@link GridSlice}) o una referencia a un archivo externo
 * ({@link ExternalSlice}). La variante se resuelve una sola vez, al construir el campo.
 */
public interface LayerSlice {

    /**
     * Materializa la capa como una matriz nueva de {@code nrow x ncol}.
     * La matriz devuelta nunca comparte memoria con el estado interno.
     */
    float[][] toArray(int nrow, int ncol);

    /**
     * @return {@code true} si la capa es un único valor difundido a todas las celdas.
     */
    default boolean isUniform() {
        return false;
    }

    /**
     * Comprueba que la capa encaja en una malla de {@code nrow x ncol}.
     *
     * @throws IllegalArgumentException si la forma no coincide.
     */
    default void requireShape(int nrow, int ncol) {
    }

    static float[][] copyOf(float[][] values) {
        float[][] copy = new float[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    static void checkShape(float[][] values, int nrow, int ncol, String what) {
        if (values.length != nrow) {
            throw new IllegalArgumentException(String.format(
                    "%s: se esperaban %d filas y se recibieron %d.", what, nrow, values.length));
        }
        for (int i = 0; i < nrow; i++) {
            if (values[i].length != ncol) {
                throw new IllegalArgumentException(String.format(
                        "%s: la fila %d tiene %d columnas en lugar de %d.", what, i + 1, values[i].length, ncol));
            }
        }
    }
}
