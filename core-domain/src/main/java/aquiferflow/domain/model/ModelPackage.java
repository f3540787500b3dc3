package aquiferflow.domain.model;

/**
 * Contrato mínimo de un paquete que puede registrarse en un {@link GroundwaterModel}.
 */
public interface ModelPackage {

    /**
     * Tipo del paquete (por ejemplo {@code "LPF"}). El modelo admite uno por tipo.
     */
    String getPackageType();

    int getUnitNumber();

    String getExtension();
}
