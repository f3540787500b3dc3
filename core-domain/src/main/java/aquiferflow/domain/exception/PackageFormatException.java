package aquiferflow.domain.exception;

import java.io.IOException;

/**
 * Error estructural al interpretar un archivo de paquete: líneas truncadas, número de
 * campos incorrecto o directivas de array no soportadas.
 * <p>
 * Es fatal: el formato es posicional y una lectura errónea desalinea el resto del archivo.
 */
public class PackageFormatException extends IOException {

    private final int lineNumber;

    public PackageFormatException(String message) {
        super(message);
        this.lineNumber = -1;
    }

    public PackageFormatException(String message, int lineNumber) {
        super(lineNumber > 0 ? message + " (línea " + lineNumber + ")" : message);
        this.lineNumber = lineNumber;
    }

    public PackageFormatException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? message + " (línea " + lineNumber + ")" : message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * @return Número de línea (base 1) donde se detectó el error, o -1 si se desconoce.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
