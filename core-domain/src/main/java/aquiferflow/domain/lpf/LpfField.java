package aquiferflow.domain.lpf;

import java.util.List;

/**
 * Los siete campos 3-D del paquete LPF.
 * <p>
 * Algunos cambian de etiqueta según el estado de sus hermanos: la conductividad vertical
 * se llama {@code vani} en las capas con LAYVKA distinto de cero, y el almacenamiento
 * específico se llama {@code storage} con la opción STORAGECOEFFICIENT. La etiqueta
 * cambia el nombre del bloque, nunca su disposición.
 */
public enum LpfField {
    HORIZONTAL_CONDUCTIVITY("hk", List.of("hk")),
    HORIZONTAL_ANISOTROPY("hani", List.of("hani")),
    VERTICAL_CONDUCTIVITY("vka", List.of("vani", "vk", "vka")),
    SPECIFIC_STORAGE("ss", List.of("ss")),
    SPECIFIC_YIELD("sy", List.of("sy")),
    CONFINING_BED_CONDUCTIVITY("vkcb", List.of("vkcb")),
    WET_DRY("wetdry", List.of());

    private final String baseName;
    private final List<String> parameterTypes;

    LpfField(String baseName, List<String> parameterTypes) {
        this.baseName = baseName;
        this.parameterTypes = parameterTypes;
    }

    public String getBaseName() {
        return baseName;
    }

    /**
     * Tipos de parámetro que pueden sustituir a este campo, en orden de preferencia.
     * Vacío si el campo nunca se parametriza.
     */
    public List<String> getParameterTypes() {
        return parameterTypes;
    }

    /**
     * Resuelve la etiqueta de una capa.
     *
     * @param vertCondFlag       Valor de LAYVKA de la capa.
     * @param storageCoefficient Si está activa la opción STORAGECOEFFICIENT.
     */
    public String resolveTag(int vertCondFlag, boolean storageCoefficient) {
        switch (this) {
            case VERTICAL_CONDUCTIVITY:
                return vertCondFlag != 0 ? "vani" : "vka";
            case SPECIFIC_STORAGE:
                return storageCoefficient ? "storage" : "ss";
            default:
                return baseName;
        }
    }
}
