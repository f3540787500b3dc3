package aquiferflow.domain.grid;

/**
 * Dimensiones de la malla de diferencias finitas de un modelo.
 * <p>
 * Las suministra el modelo propietario y ningún paquete las modifica.
 *
 * @param nrow Número de filas.
 * @param ncol Número de columnas.
 * @param nlay Número de capas.
 * @param nper Número de periodos de estrés.
 */
public record GridDimensions(int nrow, int ncol, int nlay, int nper) {

    public GridDimensions {
        if (nrow <= 0 || ncol <= 0 || nlay <= 0 || nper <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Las dimensiones de la malla deben ser positivas (nrow=%d, ncol=%d, nlay=%d, nper=%d).",
                    nrow, ncol, nlay, nper));
        }
    }

    public int cellsPerLayer() {
        return nrow * ncol;
    }
}
