package aquiferflow.io.param;

import java.util.List;
import java.util.Locale;

/**
 * Cluster de un parámetro: capa (base 1), array multiplicador, array de zonas y las zonas
 * a las que se aplica.
 */
public record ParameterCluster(int layer, String multiplierArray, String zoneArray, List<Integer> zones) {

    public static final String NO_MULTIPLIER = "none";
    public static final String ALL_ZONES = "all";

    public ParameterCluster {
        zones = List.copyOf(zones);
    }

    public boolean usesMultiplier() {
        return !NO_MULTIPLIER.equals(multiplierArray.toLowerCase(Locale.ROOT));
    }

    public boolean usesZones() {
        return !ALL_ZONES.equals(zoneArray.toLowerCase(Locale.ROOT));
    }
}
