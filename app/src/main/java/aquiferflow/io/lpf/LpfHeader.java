package aquiferflow.io.lpf;

import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.domain.lpf.LpfOption;
import aquiferflow.io.LineSource;
import aquiferflow.utils.NumberFormats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Línea de cabecera del paquete: {@code IPAKCB HDRY NPLPF [opciones]}.
 * <p>
 * Se escribe con anchos fijos ({@code I10}, {@code G10.6}, {@code I10}) y se lee por
 * tokens, de modo que acepta también cabeceras en formato libre.
 */
public record LpfHeader(int saveBudgetFlag, float dryHead, int parameterCount, Set<LpfOption> options) {

    private static final int HDRY_WIDTH = 10;

    public LpfHeader {
        options = options.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(options));
    }

    /**
     * Cabecera en columnas fijas. Si HDRY no cabe en sus 10 columnas se antepone un espacio
     * para que siga separado de IPAKCB al leerla por tokens.
     */
    public String format() {
        String hdry = NumberFormats.general(dryHead, 6, true);
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%10d", saveBudgetFlag))
                .append(hdry.length() < HDRY_WIDTH ? NumberFormats.padLeft(hdry, HDRY_WIDTH) : " " + hdry)
                .append(String.format(Locale.ROOT, "%10d", parameterCount));
        if (!options.isEmpty()) {
            sb.append(' ').append(options.stream().map(Enum::name).collect(Collectors.joining(" ")));
        }
        return sb.toString();
    }

    /**
     * Interpreta la cabecera. Los tokens que siguen a NPLPF y no son opciones se ignoran.
     *
     * @throws PackageFormatException si faltan los tres valores obligatorios o no son numéricos.
     */
    public static LpfHeader parse(String line, LineSource source) throws PackageFormatException {
        List<String> tokens = LineSource.tokenize(line);
        if (tokens.size() < 3) {
            throw new PackageFormatException(String.format(
                    "La cabecera debe contener IPAKCB, HDRY y NPLPF: '%s'", line.trim()), source.getLineNumber());
        }
        int ipakcb = source.parseInt(tokens.get(0), "IPAKCB");
        float hdry = source.parseReal(tokens.get(1), "HDRY");
        int nplpf = source.parseInt(tokens.get(2), "NPLPF");
        if (nplpf < 0) {
            throw new PackageFormatException("NPLPF no puede ser negativo: " + nplpf, source.getLineNumber());
        }
        return new LpfHeader(ipakcb, hdry, nplpf, LpfOption.parse(tokens.subList(3, tokens.size())));
    }

    /**
     * Tokens de la cabecera, tras NPLPF, que no corresponden a ninguna opción.
     */
    public static List<String> unrecognizedTokens(String line) {
        List<String> tokens = LineSource.tokenize(line);
        List<String> unknown = new ArrayList<>();
        for (int t = 3; t < tokens.size(); t++) {
            if (LpfOption.fromToken(tokens.get(t)).isEmpty()) {
                unknown.add(tokens.get(t));
            }
        }
        return unknown;
    }
}
