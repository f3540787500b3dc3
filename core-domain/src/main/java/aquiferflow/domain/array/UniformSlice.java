package aquiferflow.domain.array;

import java.util.Arrays;

/**
 * Capa con un único valor para todas sus celdas.
 */
public record UniformSlice(float value) implements LayerSlice {

    @Override
    public float[][] toArray(int nrow, int ncol) {
        float[][] data = new float[nrow][ncol];
        for (float[] row : data) {
            Arrays.fill(row, value);
        }
        return data;
    }

    @Override
    public boolean isUniform() {
        return true;
    }
}
