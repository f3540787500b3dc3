package aquiferflow.validation;

/**
 * Nivel de detalle del informe de validación.
 */
public enum CheckLevel {
    /** Una línea de resumen por campo. */
    SUMMARY,
    /** Resumen más la lista de celdas erróneas. */
    DETAILED
}
