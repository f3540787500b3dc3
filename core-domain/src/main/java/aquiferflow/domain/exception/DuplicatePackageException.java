package aquiferflow.domain.exception;

/**
 * Se intentó registrar un segundo paquete del mismo tipo en un modelo.
 */
public class DuplicatePackageException extends RuntimeException {

    public DuplicatePackageException(String packageType) {
        super("El modelo ya contiene un paquete de tipo " + packageType + ".");
    }
}
