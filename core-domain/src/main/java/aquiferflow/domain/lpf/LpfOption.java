package aquiferflow.domain.lpf;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Opciones de la cabecera del paquete LPF. Son independientes entre sí y se escriben
 * siempre en el orden de declaración.
 */
public enum LpfOption {
    /** Ss se interpreta como coeficiente de almacenamiento confinado. */
    STORAGECOEFFICIENT,
    /** La conductancia vertical se calcula con el espesor de celda. */
    CONSTANTCV,
    /** Capas con LAYTYP negativo usan STRT-BOT como espesor. */
    THICKSTRT,
    /** Sin corrección de la conductancia vertical. */
    NOCVCORRECTION,
    /** Sin corrección de flujo vertical en celdas desaturadas. */
    NOVFC;

    /**
     * Interpreta los tokens de opciones de la cabecera. Solo importa la presencia;
     * los tokens que no contienen ninguna opción se ignoran.
     */
    public static Set<LpfOption> parse(List<String> tokens) {
        Set<LpfOption> options = EnumSet.noneOf(LpfOption.class);
        for (String token : tokens) {
            fromToken(token).ifPresent(options::add);
        }
        return options;
    }

    public static Optional<LpfOption> fromToken(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        for (LpfOption option : values()) {
            if (upper.contains(option.name())) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }
}
