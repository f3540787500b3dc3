package aquiferflow.io.param;

import aquiferflow.domain.model.GroundwaterModel;
import aquiferflow.io.LineSource;

import java.io.IOException;

/**
 * Carga las definiciones de parámetros que siguen a la cabecera de un paquete.
 */
@FunctionalInterface
public interface ParameterLoader {

    /**
     * @param source         Fuente posicionada justo antes de la primera definición.
     * @param parameterCount Número de parámetros a leer (mayor que cero).
     * @param model          Modelo que aporta los arrays multiplicadores y de zonas.
     */
    ParameterSet load(LineSource source, int parameterCount, GroundwaterModel model) throws IOException;
}
