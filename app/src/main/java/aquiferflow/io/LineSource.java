package aquiferflow.io;

import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.utils.NumberFormats;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lector de líneas con número de línea, para mensajes de error precisos.
 * <p>
 * El fin de archivo inesperado se convierte en {@link PackageFormatException}: en un
 * formato posicional no hay forma de recuperarse de un archivo truncado.
 */
public final class LineSource {

    private final BufferedReader reader;
    private final String sourceName;
    private int lineNumber;

    public LineSource(BufferedReader reader, String sourceName) {
        this.reader = Objects.requireNonNull(reader, "El lector no puede ser nulo.");
        this.sourceName = sourceName != null ? sourceName : "<stream>";
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * @return Número (base 1) de la última línea leída.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Lee la siguiente línea.
     *
     * @param expected Descripción de lo que se esperaba leer, para el mensaje de error.
     * @throws PackageFormatException si se alcanza el fin de archivo.
     */
    public String nextLine(String expected) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            throw new PackageFormatException(String.format(
                    "Fin de archivo inesperado en %s leyendo %s", sourceName, expected), lineNumber + 1);
        }
        lineNumber++;
        return line;
    }

    /**
     * Lee la siguiente línea que no sea un comentario ({@code #} en la primera columna).
     */
    public String nextNonCommentLine(String expected) throws IOException {
        while (true) {
            String line = nextLine(expected);
            if (!line.startsWith("#")) {
                return line;
            }
        }
    }

    /**
     * Divide una línea en tokens separados por espacios o comas, respetando las comillas
     * simples y dobles.
     */
    public static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c) || c == ',') {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Lee {@code count} reales en formato libre a partir de la línea siguiente. Los valores
     * pueden repartirse en varias líneas y admiten repeticiones {@code r*v}. Lo que quede
     * en la última línea tras el último valor se descarta.
     */
    public float[] readFreeReals(int count, String what) throws IOException {
        float[] values = new float[count];
        int filled = 0;
        while (filled < count) {
            String line = nextLine(what);
            for (String token : tokenize(line)) {
                if (filled >= count) {
                    break;
                }
                int repeat = 1;
                String text = token;
                int star = token.indexOf('*');
                if (star > 0) {
                    repeat = parseInt(token.substring(0, star), what);
                    text = token.substring(star + 1);
                }
                float value = parseReal(text, what);
                for (int r = 0; r < repeat && filled < count; r++) {
                    values[filled++] = value;
                }
            }
        }
        return values;
    }

    /**
     * Interpreta un real e informa de la línea actual si el texto no es numérico.
     */
    public float parseReal(String token, String what) throws PackageFormatException {
        try {
            return NumberFormats.parseReal(token);
        } catch (NumberFormatException e) {
            throw new PackageFormatException(String.format(
                    "Valor real no válido '%s' en %s leyendo %s", token, sourceName, what), lineNumber, e);
        }
    }

    /**
     * Interpreta un entero e informa de la línea actual si el texto no es numérico.
     */
    public int parseInt(String token, String what) throws PackageFormatException {
        try {
            return NumberFormats.parseInteger(token);
        } catch (NumberFormatException e) {
            throw new PackageFormatException(String.format(
                    "Valor entero no válido '%s' en %s leyendo %s", token, sourceName, what), lineNumber, e);
        }
    }
}
