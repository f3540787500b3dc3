package aquiferflow.io.array;

import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.io.LineSource;
import aquiferflow.utils.NumberFormats;

import java.util.List;
import java.util.Locale;

/**
 * Registro de control que precede a cada bloque de array.
 * <p>
 * Formas reconocidas:
 * <ul>
 * <li>{@code CONSTANT valor}</li>
 * <li>{@code INTERNAL mult fmtin iprn}</li>
 * <li>{@code EXTERNAL unidad mult fmtin iprn}</li>
 * <li>{@code OPEN/CLOSE ruta mult fmtin iprn}</li>
 * <li>Registro de columnas fijas {@code LOCAT(I10) CNSTNT(F10) FMTIN(A20) IPRN(I10)}.</li>
 * </ul>
 * Todo lo que sigue a {@code #} es comentario.
 */
public record ArrayControlRecord(Kind kind, float value, FortranFormat format, int printCode, int unit,
                                 String location) {

    public enum Kind {
        CONSTANT,
        INTERNAL,
        EXTERNAL,
        OPEN_CLOSE
    }

    public static ArrayControlRecord constant(float value) {
        return new ArrayControlRecord(Kind.CONSTANT, value, FortranFormat.FREE, -1, 0, null);
    }

    /**
     * Interpreta un registro de control.
     *
     * @param line        Texto de la línea.
     * @param lineNumber  Número de línea para los mensajes.
     * @param packageUnit Unidad del propio paquete: un LOCAT igual a ella significa datos internos.
     */
    public static ArrayControlRecord parse(String line, int lineNumber, int packageUnit)
            throws PackageFormatException {
        String body = stripComment(line);
        List<String> tokens = LineSource.tokenize(body);
        if (tokens.isEmpty()) {
            throw new PackageFormatException("Registro de control de array vacío", lineNumber);
        }
        String keyword = tokens.get(0).toUpperCase(Locale.ROOT);
        try {
            switch (keyword) {
                case "CONSTANT":
                    require(tokens, 2, line, lineNumber);
                    return constant(NumberFormats.parseReal(tokens.get(1)));
                case "INTERNAL":
                    return new ArrayControlRecord(Kind.INTERNAL,
                            tokens.size() > 1 ? NumberFormats.parseReal(tokens.get(1)) : 1.0f,
                            FortranFormat.parse(tokens.size() > 2 ? tokens.get(2) : null, lineNumber),
                            tokens.size() > 3 ? NumberFormats.parseInteger(tokens.get(3)) : -1,
                            0, null);
                case "EXTERNAL":
                    require(tokens, 2, line, lineNumber);
                    return new ArrayControlRecord(Kind.EXTERNAL,
                            tokens.size() > 2 ? NumberFormats.parseReal(tokens.get(2)) : 1.0f,
                            FortranFormat.parse(tokens.size() > 3 ? tokens.get(3) : null, lineNumber),
                            tokens.size() > 4 ? NumberFormats.parseInteger(tokens.get(4)) : -1,
                            NumberFormats.parseInteger(tokens.get(1)), null);
                case "OPEN/CLOSE":
                    require(tokens, 2, line, lineNumber);
                    return new ArrayControlRecord(Kind.OPEN_CLOSE,
                            tokens.size() > 2 ? NumberFormats.parseReal(tokens.get(2)) : 1.0f,
                            FortranFormat.parse(tokens.size() > 3 ? tokens.get(3) : null, lineNumber),
                            tokens.size() > 4 ? NumberFormats.parseInteger(tokens.get(4)) : -1,
                            0, tokens.get(1));
                default:
                    return parseFixed(body, tokens, lineNumber, packageUnit);
            }
        } catch (NumberFormatException e) {
            throw new PackageFormatException("Registro de control de array no válido: '" + line.trim() + "'",
                    lineNumber, e);
        }
    }

    private static ArrayControlRecord parseFixed(String body, List<String> tokens, int lineNumber, int packageUnit)
            throws PackageFormatException {
        int locat;
        float cnstnt;
        String fmtin;
        int iprn;
        try {
            locat = NumberFormats.parseInteger(column(body, 0, 10));
            String constantText = column(body, 10, 20);
            cnstnt = constantText.isEmpty() ? 0.0f : NumberFormats.parseReal(constantText);
            fmtin = column(body, 20, 40);
            String iprnText = column(body, 40, 50);
            iprn = iprnText.isEmpty() ? -1 : NumberFormats.parseInteger(iprnText);
        } catch (NumberFormatException columnsFailed) {
            // Sin columnas fijas: se admite el mismo registro separado por espacios.
            locat = NumberFormats.parseInteger(tokens.get(0));
            cnstnt = tokens.size() > 1 ? NumberFormats.parseReal(tokens.get(1)) : 0.0f;
            fmtin = tokens.size() > 2 ? tokens.get(2) : null;
            iprn = tokens.size() > 3 ? NumberFormats.parseInteger(tokens.get(3)) : -1;
        }
        if (locat == 0) {
            return constant(cnstnt);
        }
        if (locat < 0) {
            throw new PackageFormatException("Los arrays binarios (LOCAT < 0) no están soportados", lineNumber);
        }
        FortranFormat format = FortranFormat.parse(fmtin, lineNumber);
        if (locat == packageUnit) {
            return new ArrayControlRecord(Kind.INTERNAL, cnstnt, format, iprn, 0, null);
        }
        return new ArrayControlRecord(Kind.EXTERNAL, cnstnt, format, iprn, locat, null);
    }

    private static String column(String text, int from, int to) {
        if (text.length() <= from) {
            return "";
        }
        return text.substring(from, Math.min(to, text.length())).trim();
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }

    private static void require(List<String> tokens, int count, String line, int lineNumber)
            throws PackageFormatException {
        if (tokens.size() < count) {
            throw new PackageFormatException("Registro de control de array incompleto: '" + line.trim() + "'",
                    lineNumber);
        }
    }

    /**
     * Aplica el multiplicador a un valor leído. Un multiplicador cero deja el valor intacto.
     */
    public float scale(float raw) {
        return value != 0.0f ? raw * value : raw;
    }
}
