package aquiferflow.domain.model;

import aquiferflow.domain.exception.DuplicatePackageException;

/**
 * Resultado de registrar un paquete en el modelo.
 */
public enum RegistrationResult {
    REGISTERED,
    DUPLICATE;

    public boolean isRegistered() {
        return this == REGISTERED;
    }

    /**
     * Convierte un registro duplicado en excepción.
     *
     * @throws DuplicatePackageException si el resultado es {@link #DUPLICATE}.
     */
    public RegistrationResult orThrow(String packageType) {
        if (this == DUPLICATE) {
            throw new DuplicatePackageException(packageType);
        }
        return this;
    }
}
