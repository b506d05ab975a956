package projectoasis.physics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import projectoasis.config.PvDensity;
import projectoasis.data.ISimulationDataProvider;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PvGenerationModelTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 1);

    @Mock
    private ISimulationDataProvider dataProvider;

    @Test
    @DisplayName("El primer día solo se aplica el sombreado de la densidad")
    void dailyKwh_firstDay() {
        when(dataProvider.pvKwhPerKw(START, PvDensity.MEDIUM)).thenReturn(5.0);
        PvGenerationModel model = new PvGenerationModel(100.0, PvDensity.MEDIUM, 0.005, START, dataProvider);

        assertThat(model.dailyKwh(START)).isCloseTo(100.0 * 5.0 * 0.90, within(1e-9));
    }

    @Test
    @DisplayName("La degradación se compone por años transcurridos")
    void dailyKwh_degradesOverTime() {
        LocalDate later = START.plusDays(1461);
        when(dataProvider.pvKwhPerKw(any(LocalDate.class), any(PvDensity.class))).thenReturn(5.0);
        PvGenerationModel model = new PvGenerationModel(100.0, PvDensity.LOW, 0.005, START, dataProvider);

        // 1461 días = 4 años de 365.25
        assertThat(model.degradationFactor(later)).isCloseTo(Math.pow(0.995, 4), within(1e-12));
        assertThat(model.dailyKwh(later)).isCloseTo(100.0 * 5.0 * Math.pow(0.995, 4) * 0.95, within(1e-9));
    }

    @Test
    @DisplayName("Sin potencia instalada no se consulta al proveedor")
    void dailyKwh_zeroCapacity() {
        PvGenerationModel model = new PvGenerationModel(0.0, PvDensity.HIGH, 0.005, START, dataProvider);

        assertThat(model.dailyKwh(START)).isZero();
        verifyNoInteractions(dataProvider);
    }
}
