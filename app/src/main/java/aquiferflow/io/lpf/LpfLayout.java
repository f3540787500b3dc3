package aquiferflow.io.lpf;

import aquiferflow.domain.array.LayerVector;
import aquiferflow.domain.lpf.LpfField;
import aquiferflow.domain.lpf.LpfPackage;
import aquiferflow.domain.model.GroundwaterModel;

import java.util.List;
import java.util.function.Predicate;

/**
 * Disposición por capa del archivo LPF, compartida por el escritor y el lector.
 * <p>
 * Cada capa contiene, en este orden, los bloques cuya condición se cumple:
 * <ol>
 * <li>hk, siempre.</li>
 * <li>hani, si CHANI de la capa es menor que 1.</li>
 * <li>vka (o vani), siempre.</li>
 * <li>ss (o storage), si el modelo es transitorio.</li>
 * <li>sy, si el modelo es transitorio y LAYTYP no es cero.</li>
 * <li>vkcb, si la capa tiene lecho confinante.</li>
 * <li>wetdry, si LAYWET y LAYTYP no son cero.</li>
 * </ol>
 */
public final class LpfLayout {

    /**
     * Estado de una capa del que dependen sus bloques.
     */
    public record LayerContext(int layer, int layerType, float horizAnisoFlag, int vertCondFlag, int wetFlag,
                               int confiningBedFlag, boolean transientModel) {
    }

    /**
     * Un bloque de la capa y su condición de presencia.
     */
    public record Step(LpfField field, Predicate<LayerContext> condition) {

        public boolean isPresent(LayerContext context) {
            return condition.test(context);
        }
    }

    public static final List<Step> STEPS = List.of(
            new Step(LpfField.HORIZONTAL_CONDUCTIVITY, c -> true),
            new Step(LpfField.HORIZONTAL_ANISOTROPY, c -> c.horizAnisoFlag() < 1.0f),
            new Step(LpfField.VERTICAL_CONDUCTIVITY, c -> true),
            new Step(LpfField.SPECIFIC_STORAGE, LayerContext::transientModel),
            new Step(LpfField.SPECIFIC_YIELD, c -> c.transientModel() && c.layerType() != 0),
            new Step(LpfField.CONFINING_BED_CONDUCTIVITY, c -> c.confiningBedFlag() > 0),
            new Step(LpfField.WET_DRY, c -> c.wetFlag() != 0 && c.layerType() != 0));

    private LpfLayout() {
    }

    public static LayerContext context(int layer, LayerVector layerType, LayerVector horizAnisoFlag,
                                       LayerVector vertCondFlag, LayerVector wetFlag, GroundwaterModel model) {
        return new LayerContext(layer, layerType.getInt(layer), horizAnisoFlag.getFloat(layer),
                vertCondFlag.getInt(layer), wetFlag.getInt(layer), model.getConfiningBedFlag(layer),
                model.isTransient());
    }

    public static LayerContext context(int layer, LpfPackage lpf, GroundwaterModel model) {
        return context(layer, lpf.getLayerType(), lpf.getHorizAnisoFlag(), lpf.getVertCondFlag(), lpf.getWetFlag(),
                model);
    }

    /**
     * La línea WETFCT IWETIT IHDWET solo aparece si la suma de LAYWET es positiva.
     */
    public static boolean hasWettingLine(LayerVector wetFlag) {
        return wetFlag.sum() > 0;
    }

    /**
     * Etiqueta del bloque: el nombre resuelto del campo y la capa en base 1.
     */
    public static String label(LpfField field, LayerContext context, boolean storageCoefficient) {
        return field.resolveTag(context.vertCondFlag(), storageCoefficient) + " layer " + (context.layer() + 1);
    }
}
