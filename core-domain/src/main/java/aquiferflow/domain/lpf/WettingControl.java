package aquiferflow.domain.lpf;

/**
 * Parámetros globales de rehumectación (WETFCT, IWETIT, IHDWET).
 * Solo se escriben cuando alguna capa tiene LAYWET distinto de cero.
 *
 * @param wetFactor        Factor del cálculo de la carga inicial de una celda rehumectada.
 * @param wetIterInterval  Cada cuántas iteraciones se intenta rehumectar.
 * @param wetEquationFlag  Ecuación usada para la carga inicial de las celdas rehumectadas.
 */
public record WettingControl(float wetFactor, int wetIterInterval, int wetEquationFlag) {

    public static final WettingControl DEFAULT = new WettingControl(0.1f, 1, 0);
}
