package aquiferflow.config;

import aquiferflow.domain.grid.GridDimensions;
import aquiferflow.domain.model.GroundwaterModel;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Descripción serializable de un modelo: dimensiones, discretización temporal, lechos
 * confinantes y máscara de celdas activas.
 *
 * @param name      Nombre del modelo.
 * @param workspace Directorio de trabajo. Si es nulo se usa el directorio por defecto del cargador.
 * @param nrow      Número de filas.
 * @param ncol      Número de columnas.
 * @param nlay      Número de capas.
 * @param nper      Número de periodos de estrés.
 * @param steady    Estado estacionario por periodo. Nulo equivale a todos estacionarios.
 * @param laycbd    Lecho confinante por capa. Nulo equivale a ninguno.
 * @param ibound    Máscara de celdas (0 = inactiva). Nula equivale a todas activas.
 * @param verbose   Eco de los informes de validación por la salida estándar.
 */
public record ModelDefinition(
        String name,
        String workspace,
        int nrow,
        int ncol,
        int nlay,
        int nper,
        boolean[] steady,
        int[] laycbd,
        int[][][] ibound,
        boolean verbose
) {

    /**
     * Construye el modelo descrito.
     *
     * @param defaultWorkspace Directorio usado cuando la definición no indica ninguno,
     *                         o base de una ruta relativa.
     */
    public GroundwaterModel toModel(Path defaultWorkspace) {
        Path base = defaultWorkspace != null ? defaultWorkspace : Paths.get(".");
        Path resolvedWorkspace = workspace == null ? base : base.resolve(workspace);
        return GroundwaterModel.builder()
                .name(name)
                .workspace(resolvedWorkspace)
                .dimensions(new GridDimensions(nrow, ncol, nlay, nper))
                .steady(steady)
                .laycbd(laycbd)
                .ibound(ibound)
                .verbose(verbose)
                .build();
    }

    public static ModelDefinition of(GroundwaterModel model) {
        GridDimensions dims = model.getDimensions();
        int[][][] ibound = null;
        if (model.hasActiveMask()) {
            boolean[][][] mask = model.getActiveMask();
            ibound = new int[dims.nlay()][dims.nrow()][dims.ncol()];
            for (int k = 0; k < dims.nlay(); k++) {
                for (int i = 0; i < dims.nrow(); i++) {
                    for (int j = 0; j < dims.ncol(); j++) {
                        ibound[k][i][j] = mask[k][i][j] ? 1 : 0;
                    }
                }
            }
        }
        return new ModelDefinition(model.getName(), null, dims.nrow(), dims.ncol(), dims.nlay(), dims.nper(),
                model.getSteadyFlags(), model.getConfiningBedFlags(), ibound, model.isVerbose());
    }
}
