package aquiferflow.io.array;

import aquiferflow.domain.exception.PackageFormatException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Descriptor de formato de un bloque de array ({@code FMTIN}).
 * <p>
 * {@code (FREE)} o {@code *} indican formato libre. Un descriptor Fortran simple como
 * {@code (10E15.6)} o {@code (20F5.1)} indica campos de ancho fijo, {@code count} por línea.
 *
 * @param free  Formato libre.
 * @param count Campos por línea (formato fijo).
 * @param width Ancho de cada campo (formato fijo).
 */
public record FortranFormat(boolean free, int count, int width) {

    public static final FortranFormat FREE = new FortranFormat(true, 0, 0);
    public static final String FREE_TEXT = "(FREE)";

    private static final Pattern FIXED = Pattern.compile(
            "\\(\\s*(\\d*)\\s*(?:1P)?\\s*(ES|EN|I|F|E|G|D)\\s*(\\d+)(?:\\.\\d+)?(?:E\\d+)?\\s*\\)");

    /**
     * @throws PackageFormatException si el formato es binario o no se reconoce.
     */
    public static FortranFormat parse(String text, int lineNumber) throws PackageFormatException {
        String normalized = text == null ? "" : text.trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty() || normalized.equals("*") || normalized.equals(FREE_TEXT)) {
            return FREE;
        }
        if (normalized.contains("BINARY")) {
            throw new PackageFormatException("Los arrays binarios no están soportados: " + text, lineNumber);
        }
        Matcher m = FIXED.matcher(normalized.replace(" ", ""));
        if (!m.matches()) {
            throw new PackageFormatException("Formato de array no soportado: " + text, lineNumber);
        }
        int count = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
        int width = Integer.parseInt(m.group(3));
        if (count <= 0 || width <= 0) {
            throw new PackageFormatException("Formato de array no válido: " + text, lineNumber);
        }
        return new FortranFormat(false, count, width);
    }
}
