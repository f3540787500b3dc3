package aquiferflow.validation;

/**
 * Celda activa cuyo valor está fuera de rango. Índices en base 0.
 */
public record CellIssue(String fieldName, int layer, int row, int column, float value) {
}
