package aquiferflow.io.lpf;

import aquiferflow.config.LpfConfig;
import aquiferflow.domain.array.FieldInput;
import aquiferflow.domain.array.GridSlice;
import aquiferflow.domain.array.UniformSlice;
import aquiferflow.domain.grid.GridDimensions;
import aquiferflow.domain.lpf.LpfPackage;
import aquiferflow.domain.model.GroundwaterModel;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Slf4j
class LpfFileWriterTest {

    @TempDir
    Path tempDir;

    private LpfFileWriter writer;

    @BeforeEach
    void setUp() {
        writer = new LpfFileWriter();
    }

    @Test
    @DisplayName("Modelo estacionario de dos capas: línea de rehumectación, vkcb y wetdry solo en la segunda capa")
    void encode_twoLayerSteadyModel_shouldFollowConditionalLayout() throws IOException {
        // Arrange
        GroundwaterModel model = GroundwaterModel.builder()
                .dimensions(new GridDimensions(2, 2, 2, 1))
                .laycbd(new int[]{0, 1})
                .build();
        LpfPackage lpf = LpfPackage.create(model, LpfConfig.builder()
                .layerType(new int[]{0, 1})
                .wetFlag(new int[]{0, 1})
                .build());

        // Act
        String text = writer.encode(lpf, model);

        // Assert
        String expected = String.join("\n",
                "# LPF for MODFLOW, generated by AquiferFlow.",
                "        53    -1E+30         0",
                "         0         1",
                "         0         0",
                "        1.0E+00        1.0E+00",
                "         0         0",
                "         0         1",
                "  0.100000         1         0",
                "CONSTANT         1.0E+00  #hk layer 1",
                "CONSTANT         1.0E+00  #vka layer 1",
                "CONSTANT         1.0E+00  #hk layer 2",
                "CONSTANT         1.0E+00  #vka layer 2",
                "CONSTANT         0.0E+00  #vkcb layer 2",
                "CONSTANT        -1.0E-02  #wetdry layer 2",
                "");
        assertThat(text).isEqualTo(expected);
        log.info("Archivo LPF generado:\n{}", text);
    }

    @Test
    @DisplayName("Sin LAYWET activo no se escribe la línea de rehumectación")
    void encode_withoutWetting_shouldOmitWettingLine() throws IOException {
        GroundwaterModel model = GroundwaterModel.builder().dimensions(new GridDimensions(1, 1, 1, 1)).build();
        LpfPackage lpf = LpfPackage.create(model, LpfConfig.builder().layerType(new int[]{1}).build());

        String text = writer.encode(lpf, model);

        assertThat(text).doesNotContain("0.100000").doesNotContain("wetdry");
        assertThat(text.split("\n")).hasSize(9);
    }

    @Test
    @DisplayName("En modelos transitorios aparecen storage, sy, hani y las etiquetas vani")
    void encode_transientModel_shouldUseResolvedTags() throws IOException {
        // Arrange
        GroundwaterModel model = GroundwaterModel.builder()
                .dimensions(new GridDimensions(1, 2, 2, 2))
                .steady(new boolean[]{true, false})
                .build();
        LpfPackage lpf = LpfPackage.create(model, LpfConfig.builder()
                .layerType(new int[]{1, 0})
                .horizAnisoFlag(new float[]{-1.0f, 1.0f})
                .vertCondFlag(new int[]{1, 0})
                .storageCoefficient(true)
                .noVfc(true)
                .vertCond(FieldInput.layers(new GridSlice(new float[][]{{10.0f, 0.5f}}), new UniformSlice(2.0f)))
                .build());

        // Act
        String text = writer.encode(lpf, model);

        // Assert
        assertThat(text.split("\n")[1]).isEqualTo("        53    -1E+30         0 STORAGECOEFFICIENT NOVFC");
        assertThat(text).contains(String.join("\n",
                "CONSTANT         1.0E+00  #hk layer 1",
                "CONSTANT         1.0E+00  #hani layer 1",
                "INTERNAL 1.0E+00 (FREE) -1  #vani layer 1",
                "        1.0E+01        5.0E-01",
                "CONSTANT         1.0E-05  #storage layer 1",
                "CONSTANT         1.5E-01  #sy layer 1",
                "CONSTANT         1.0E+00  #hk layer 2",
                "CONSTANT         2.0E+00  #vka layer 2",
                "CONSTANT         1.0E-05  #storage layer 2",
                ""));
        assertThat(text).doesNotContain("hani layer 2").doesNotContain("sy layer 2");
    }

    @Test
    @DisplayName("Un paquete con parámetros se escribe con NPLPF=0 y sus valores materializados")
    void encode_withParameterCount_shouldWriteZero() throws IOException {
        GroundwaterModel model = GroundwaterModel.builder().dimensions(new GridDimensions(1, 1, 1, 1)).build();
        LpfPackage lpf = LpfPackage.create(model, LpfConfig.builder().parameterCount(3).saveBudgetFlag(0).build());

        String text = writer.encode(lpf, model);

        assertThat(text.split("\n")[1]).isEqualTo("         0    -1E+30         0");
    }

    @Test
    @DisplayName("Escribir en el directorio del modelo crea el archivo del paquete y el informe de validación")
    void write_toWorkspace_shouldCreatePackageAndCheckFiles() throws IOException {
        GroundwaterModel model = GroundwaterModel.builder()
                .name("acuifero")
                .workspace(tempDir)
                .dimensions(new GridDimensions(1, 1, 1, 1))
                .build();
        LpfPackage lpf = LpfPackage.create(model, LpfConfig.builder().horizCond(FieldInput.uniform(-1.0f)).build());

        Path written = writer.write(lpf, model);

        assertThat(written).isEqualTo(tempDir.resolve("acuifero.lpf")).exists();
        assertThat(Files.readString(written)).startsWith(LpfFileWriter.HEADING + "\n");
        assertThat(Files.readString(tempDir.resolve(LpfFileWriter.CHECK_FILE)))
                .contains("ERROR: Negative horizontal hydraulic conductivity specified.")
                .contains("DETAILED SUMMARY OF LPF ERRORS");
    }

    @Test
    @DisplayName("Sin validación no se genera el informe")
    void write_withoutCheck_shouldNotCreateCheckFile() throws IOException {
        GroundwaterModel model = GroundwaterModel.builder()
                .workspace(tempDir)
                .dimensions(new GridDimensions(1, 1, 1, 1))
                .build();
        LpfPackage lpf = LpfPackage.create(model, LpfConfig.defaults());
        Path target = tempDir.resolve("out/custom.lpf");

        writer.write(lpf, model, target, false);

        assertThat(target).exists();
        assertThat(tempDir.resolve(LpfFileWriter.CHECK_FILE)).doesNotExist();
    }

    @Test
    @DisplayName("Un paquete construido para otra malla es rechazado")
    void encode_withDifferentGrid_shouldThrow() {
        GroundwaterModel model = GroundwaterModel.builder().dimensions(new GridDimensions(2, 2, 1, 1)).build();
        LpfPackage lpf = LpfPackage.create(new GridDimensions(3, 3, 1, 1), LpfConfig.defaults());

        assertThatThrownBy(() -> writer.encode(lpf, model))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Cambiar LAYVKA solo cambia ese vector y la etiqueta vka/vani, no la disposición")
    void encode_flippedVertCondFlag_shouldOnlyRenameTag() throws IOException {
        // Arrange
        GroundwaterModel model = GroundwaterModel.builder()
                .dimensions(new GridDimensions(1, 2, 2, 2))
                .steady(new boolean[]{true, false})
                .laycbd(new int[]{1, 0})
                .build();
        LpfConfig config = LpfConfig.builder()
                .layerType(new int[]{1, 0})
                .horizAnisoFlag(new float[]{-1.0f, 1.0f})
                .wetFlag(new int[]{1, 0})
                .vertCondFlag(new int[]{0, 0})
                .vertCond(FieldInput.layers(new GridSlice(new float[][]{{3.0f, 4.0f}}), new UniformSlice(2.0f)))
                .build();

        // Act
        String[] asVka = writer.encode(LpfPackage.create(model, config), model).split("\n");
        String[] asVani = writer.encode(LpfPackage.create(model, config.withVertCondFlag(new int[]{1, 1})), model)
                .split("\n");

        // Assert
        assertThat(asVani).hasSameSizeAs(asVka);
        int layvkaLine = 5;
        assertThat(asVka[layvkaLine]).isEqualTo("         0         0");
        assertThat(asVani[layvkaLine]).isEqualTo("         1         1");
        for (int i = 0; i < asVka.length; i++) {
            if (i != layvkaLine) {
                assertThat(asVani[i]).as("línea %d", i + 1)
                        .isEqualTo(asVka[i].replace("#vka layer", "#vani layer"));
            }
        }
        assertThat(asVani).contains("CONSTANT         2.0E+00  #vani layer 2");
    }
}
