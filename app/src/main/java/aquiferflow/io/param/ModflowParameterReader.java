package aquiferflow.io.param;

import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.domain.model.GroundwaterModel;
import aquiferflow.io.LineSource;
import aquiferflow.utils.NumberFormats;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lee definiciones de parámetros en el formato de MODFLOW-2005:
 * <pre>
 * PARNAM PARTYP Parval NCLU
 * Layer Mltarr Zonarr [IZ ...]     (NCLU líneas)
 * </pre>
 * Los nombres de array se truncan a 10 caracteres. La lista de zonas termina en el primer
 * token no entero y las zonas cero se ignoran.
 */
@Slf4j
public class ModflowParameterReader implements ParameterLoader {

    private static final int MAX_ARRAY_NAME = 10;

    @Override
    public ParameterSet load(LineSource source, int parameterCount, GroundwaterModel model) throws IOException {
        List<ParameterDefinition> definitions = new ArrayList<>(parameterCount);
        for (int p = 0; p < parameterCount; p++) {
            String line = source.nextLine("definición del parámetro " + (p + 1));
            List<String> tokens = LineSource.tokenize(line);
            if (tokens.size() < 4) {
                throw new PackageFormatException("Definición de parámetro incompleta: '" + line.trim() + "'",
                        source.getLineNumber());
            }
            String name = tokens.get(0).toLowerCase(Locale.ROOT);
            String type = tokens.get(1).toLowerCase(Locale.ROOT);
            float value = source.parseReal(tokens.get(2), "Parval de " + name);
            int clusterCount = source.parseInt(tokens.get(3), "NCLU de " + name);

            List<ParameterCluster> clusters = new ArrayList<>(clusterCount);
            for (int c = 0; c < clusterCount; c++) {
                clusters.add(readCluster(source, name, c));
            }
            definitions.add(new ParameterDefinition(name, type, value, clusters));
            log.debug("Parámetro {} de tipo {} cargado ({} clusters, valor {}).", name, type, clusterCount, value);
        }
        return new ParameterSet(definitions, model);
    }

    private ParameterCluster readCluster(LineSource source, String name, int index) throws IOException {
        String line = source.nextLine("cluster " + (index + 1) + " del parámetro " + name);
        List<String> tokens = LineSource.tokenize(line);
        if (tokens.size() < 3) {
            throw new PackageFormatException("Cluster de parámetro incompleto: '" + line.trim() + "'",
                    source.getLineNumber());
        }
        int layer = source.parseInt(tokens.get(0), "capa del cluster de " + name);
        String mltarr = truncate(tokens.get(1));
        String zonarr = truncate(tokens.get(2));
        List<Integer> zones = new ArrayList<>();
        for (String token : tokens.subList(3, tokens.size())) {
            int zone;
            try {
                zone = NumberFormats.parseInteger(token);
            } catch (NumberFormatException endOfZones) {
                break;
            }
            if (zone != 0) {
                zones.add(zone);
            }
        }
        return new ParameterCluster(layer, mltarr, zonarr, zones);
    }

    private static String truncate(String arrayName) {
        return arrayName.length() > MAX_ARRAY_NAME ? arrayName.substring(0, MAX_ARRAY_NAME) : arrayName;
    }
}
