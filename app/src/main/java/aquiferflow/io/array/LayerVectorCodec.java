package aquiferflow.io.array;

import aquiferflow.domain.array.LayerVector;
import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.io.LineSource;
import aquiferflow.utils.NumberFormats;

import java.io.IOException;
import java.util.Locale;

/**
 * Vectores de control por capa: se escriben sin registro de control, en formato libre, y se
 * leen hasta completar {@code nlay} valores.
 */
public final class LayerVectorCodec {

    private static final int INT_WIDTH = 10;

    private LayerVectorCodec() {
    }

    public static String format(LayerVector vector) {
        StringBuilder sb = new StringBuilder();
        for (int k = 0; k < vector.size(); k++) {
            if (vector.isIntegral()) {
                sb.append(String.format(Locale.ROOT, "%" + INT_WIDTH + "d", vector.getInt(k)));
            } else {
                sb.append(NumberFormats.padLeft(NumberFormats.exactFloat(vector.getFloat(k)),
                        ArrayBlockWriter.REAL_WIDTH));
            }
            if ((k + 1) % ArrayBlockWriter.VALUES_PER_LINE == 0 || k == vector.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public static int[] readInts(LineSource source, String name, int nlay) throws IOException {
        float[] raw = source.readFreeReals(nlay, name);
        int[] values = new int[nlay];
        for (int k = 0; k < nlay; k++) {
            if (raw[k] != Math.rint(raw[k])) {
                throw new PackageFormatException(String.format(
                        "El vector %s debe ser entero y contiene %s", name, raw[k]), source.getLineNumber());
            }
            values[k] = (int) raw[k];
        }
        return values;
    }

    public static float[] readFloats(LineSource source, String name, int nlay) throws IOException {
        return source.readFreeReals(nlay, name);
    }
}
