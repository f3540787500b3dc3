package aquiferflow.io.param;

import aquiferflow.domain.exception.PackageFormatException;
import aquiferflow.domain.grid.GridDimensions;
import aquiferflow.domain.model.GroundwaterModel;
import aquiferflow.io.LineSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModflowParameterReaderTest {

    private static final String DEFINITIONS = String.join("\n",
            "HK_1 HK 1.5 2",
            "1 MULT_ONE_LONGER ALL",
            "2 NONE zones 2 0 x 1",
            "VANI_1 VANI 4.0 1",
            "1 NONE ALL",
            "");

    private ModflowParameterReader reader;
    private GroundwaterModel model;

    @BeforeEach
    void setUp() {
        reader = new ModflowParameterReader();
        model = GroundwaterModel.builder()
                .dimensions(new GridDimensions(1, 2, 2, 1))
                .multiplierArray("mult_one_l", new float[][]{{2.0f, 3.0f}})
                .zoneArray("ZONES", new int[][]{{1, 2}})
                .build();
    }

    private static LineSource sourceOf(String text) {
        return new LineSource(new BufferedReader(new StringReader(text)), "test");
    }

    @Test
    @DisplayName("Las definiciones se leen con nombres truncados y zonas filtradas")
    void load_shouldParseDefinitionsAndClusters() throws IOException {
        ParameterSet parameters = reader.load(sourceOf(DEFINITIONS), 2, model);

        assertThat(parameters.getTypes()).containsExactly("hk", "vani");
        ParameterDefinition hk = parameters.getDefinitions().get(0);
        assertThat(hk.name()).isEqualTo("hk_1");
        assertThat(hk.value()).isEqualTo(1.5f);
        assertThat(hk.clusters()).containsExactly(
                new ParameterCluster(1, "MULT_ONE_L", "ALL", List.of()),
                new ParameterCluster(2, "NONE", "zones", List.of(2)));
    }

    @Test
    @DisplayName("El relleno suma valor por multiplicador en las zonas de cada cluster de la capa")
    void fill_shouldApplyMultipliersAndZones() throws IOException {
        ParameterSet parameters = reader.load(sourceOf(DEFINITIONS), 2, model);

        assertThat(parameters.fill("hk", 0, 1, 2)).isDeepEqualTo(new float[][]{{3.0f, 4.5f}});
        assertThat(parameters.fill("hk", 1, 1, 2)).isDeepEqualTo(new float[][]{{0.0f, 1.5f}});
        assertThat(parameters.fill("vani", 1, 1, 2)).isDeepEqualTo(new float[][]{{0.0f, 0.0f}});
    }

    @Test
    @DisplayName("El valor fijado en el modelo sustituye al valor del paquete")
    void fill_withModelOverride_shouldUseOverride() throws IOException {
        GroundwaterModel overridden = GroundwaterModel.builder()
                .dimensions(new GridDimensions(1, 2, 2, 1))
                .multiplierArray("mult_one_l", new float[][]{{2.0f, 3.0f}})
                .zoneArray("zones", new int[][]{{1, 2}})
                .parameterValue("HK_1", 2.0f)
                .build();

        ParameterSet parameters = reader.load(sourceOf(DEFINITIONS), 2, overridden);

        assertThat(parameters.fill("hk", 0, 1, 2)).isDeepEqualTo(new float[][]{{4.0f, 6.0f}});
    }

    @Test
    @DisplayName("El tipo preferido es el primero de la lista que está definido")
    void firstDefined_shouldFollowPreference() throws IOException {
        ParameterSet parameters = reader.load(sourceOf(DEFINITIONS), 2, model);

        assertThat(parameters.firstDefined(List.of("vani", "vk", "vka"))).contains("vani");
        assertThat(parameters.firstDefined(List.of("ss"))).isEmpty();
        assertThat(ParameterSet.EMPTY.firstDefined(List.of("hk"))).isEmpty();
    }

    @Test
    @DisplayName("Un array multiplicador que el modelo no define es un error de formato")
    void fill_withUnknownMultiplier_shouldThrow() throws IOException {
        ParameterSet parameters = reader.load(sourceOf("SY_1 SY 0.2 1\n1 missing ALL\n"), 1, model);

        assertThatThrownBy(() -> parameters.fill("sy", 0, 1, 2))
                .isInstanceOf(PackageFormatException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("Una definición incompleta o truncada es un error de formato")
    void load_withIncompleteDefinition_shouldThrow() {
        assertThatThrownBy(() -> reader.load(sourceOf("HK_1 HK 1.5\n"), 1, model))
                .isInstanceOf(PackageFormatException.class);
        assertThatThrownBy(() -> reader.load(sourceOf("HK_1 HK 1.5 2\n1 NONE ALL\n"), 1, model))
                .isInstanceOf(PackageFormatException.class);
    }
}
