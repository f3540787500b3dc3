package aquiferflow.domain.model;

import aquiferflow.domain.exception.DuplicatePackageException;
import aquiferflow.domain.grid.GridDimensions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GroundwaterModelTest {

    @Mock
    private ModelPackage first;
    @Mock
    private ModelPackage second;

    private GroundwaterModel model;

    @BeforeEach
    void setUp() {
        model = GroundwaterModel.builder()
                .dimensions(new GridDimensions(2, 2, 2, 2))
                .build();
    }

    @Test
    @DisplayName("Solo se admite un paquete por tipo")
    void registerPackage_whenTypeAlreadyPresent_shouldReportDuplicate() {
        // Arrange
        when(first.getPackageType()).thenReturn("LPF");
        when(second.getPackageType()).thenReturn("lpf");

        // Act
        RegistrationResult firstResult = model.registerPackage(first);
        RegistrationResult secondResult = model.registerPackage(second);

        // Assert
        assertThat(firstResult.isRegistered()).isTrue();
        assertThat(secondResult).isEqualTo(RegistrationResult.DUPLICATE);
        assertThat(model.getPackage("LPF")).containsSame(first);
        assertThatThrownBy(() -> secondResult.orThrow("LPF"))
                .isInstanceOf(DuplicatePackageException.class);
    }

    @Test
    @DisplayName("Por defecto todos los periodos son estacionarios y no hay lechos confinantes")
    void defaults_shouldBeSteadyWithoutConfiningBeds() {
        assertThat(model.isTransient()).isFalse();
        assertThat(model.getConfiningBedFlags()).containsExactly(0, 0);
        assertThat(model.hasActiveMask()).isFalse();
        assertThat(model.isActive(1, 1, 1)).isTrue();
        assertThat(model.resolveFile("lpf")).isEqualTo(Paths.get(".").resolve("modflowtest.lpf"));
    }

    @Test
    @DisplayName("Un periodo no estacionario hace el modelo transitorio")
    void isTransient_withOneTransientPeriod_shouldBeTrue() {
        GroundwaterModel transientModel = GroundwaterModel.builder()
                .dimensions(new GridDimensions(1, 1, 1, 2))
                .steady(new boolean[]{true, false})
                .build();

        assertThat(transientModel.isTransient()).isTrue();
    }

    @Test
    @DisplayName("La máscara de celdas debe coincidir con la malla")
    void builder_withWrongIboundShape_shouldThrow() {
        assertThatThrownBy(() -> GroundwaterModel.builder()
                .dimensions(new GridDimensions(2, 2, 1, 1))
                .ibound(new int[][][]{{{1, 1}}})
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Los arrays de parámetros se buscan sin distinguir mayúsculas")
    void parameterArrays_shouldBeCaseInsensitive() {
        GroundwaterModel withArrays = GroundwaterModel.builder()
                .dimensions(new GridDimensions(1, 1, 1, 1))
                .multiplierArray("MULT1", new float[][]{{2.0f}})
                .zoneArray("Zones", new int[][]{{1}})
                .parameterValue("HK_1", 4.0f)
                .build();

        assertThat(withArrays.getMultiplierArray("mult1")).isPresent();
        assertThat(withArrays.getZoneArray("ZONES")).isPresent();
        assertThat(withArrays.getParameterValue("hk_1")).contains(4.0f);
        assertThat(withArrays.getMultiplierArray("other")).isEmpty();
    }
}
