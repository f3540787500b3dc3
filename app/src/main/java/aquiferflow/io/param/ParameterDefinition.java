package aquiferflow.io.param;

import java.util.List;

/**
 * Definición de un parámetro multiplicador/zona leída de un paquete.
 *
 * @param name     PARNAM en minúsculas.
 * @param type     PARTYP en minúsculas (hk, hani, vk, vani, ss, sy, vkcb).
 * @param value    Parval.
 * @param clusters Clusters del parámetro.
 */
public record ParameterDefinition(String name, String type, float value, List<ParameterCluster> clusters) {

    public ParameterDefinition {
        clusters = List.copyOf(clusters);
    }
}
