package projectoasis.physics.dispatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.domain.energy.DailyEnergyRecord;
import projectoasis.domain.energy.EnergyState;
import projectoasis.physics.i.IGenerationModel;

import java.time.LocalDate;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MeritOrderEnergyDispatcherTest {

    private static final LocalDate DAY = LocalDate.of(2025, 7, 1);

    @Mock
    private IGenerationModel pvModel;
    @Mock
    private IGenerationModel windModel;
    @Mock
    private ISimulationDataProvider dataProvider;

    private MeritOrderEnergyDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new MeritOrderEnergyDispatcher(pvModel, windModel, dataProvider);
    }

    private static EnergyState.EnergyStateBuilder stateBuilder() {
        return EnergyState.builder()
                .pvCapacityKw(0.0)
                .windCapacityKw(0.0)
                .batteryCapacityKwh(0.0)
                .initialSoc(0.5)
                .socMin(0.1)
                .socMax(0.9)
                .chargeEfficiency(0.95)
                .dischargeEfficiency(0.95)
                .generatorCapacityKw(0.0)
                .fuelCoefficientA(0.06)
                .fuelCoefficientB(0.20)
                .gridConnected(true);
    }

    @Test
    @DisplayName("Excedente: la batería carga hasta socMax y el resto se exporta")
    void balance_surplusChargesThenExports() {
        // --- 1. Arrange ---
        EnergyState state = stateBuilder().batteryCapacityKwh(50.0).initialSoc(0.1).build();

        // --- 2. Act ---
        DailyEnergyRecord record = dispatcher.balance(state, DAY, 100.0, 150.0, 0.0);

        // --- 3. Assert ---
        // Hueco: (0.9 − 0.1) · 50 / 0.95
        assertThat(record.batteryChargeKwh()).isCloseTo(42.105, within(1e-3));
        assertThat(record.gridExportKwh()).isCloseTo(7.895, within(1e-3));
        assertThat(record.curtailedKwh()).isZero();
        assertThat(record.gridImportKwh()).isZero();
        assertThat(state.getBatterySoc()).isCloseTo(0.9, within(1e-9));
        assertThat(record.batterySoc()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("Un ciclo completo de carga y descarga devuelve el 90.25 % de la energía")
    void balance_roundTripEfficiency() {
        // socMin = SOC inicial: solo es descargable lo que se acaba de cargar
        EnergyState state = stateBuilder().batteryCapacityKwh(100.0).initialSoc(0.5).socMin(0.5).build();

        DailyEnergyRecord charge = dispatcher.balance(state, DAY, 0.0, 10.0, 0.0);
        DailyEnergyRecord discharge = dispatcher.balance(state, DAY.plusDays(1), 100.0, 0.0, 0.0);

        assertThat(charge.batteryChargeKwh()).isCloseTo(10.0, within(1e-9));
        assertThat(discharge.batteryDischargeKwh() / charge.batteryChargeKwh()).isCloseTo(0.9025, within(1e-9));
        assertThat(discharge.gridImportKwh()).isCloseTo(100.0 - 9.025, within(1e-9));
        assertThat(state.getBatterySoc()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Déficit: la batería descarga hasta socMin antes de importar de la red")
    void balance_deficitDischargesThenImports() {
        EnergyState state = stateBuilder().batteryCapacityKwh(100.0).initialSoc(0.3).build();

        DailyEnergyRecord record = dispatcher.balance(state, DAY, 80.0, 20.0, 10.0);

        // Disponible: (0.3 − 0.1) · 100 · 0.95 = 19
        assertThat(record.batteryDischargeKwh()).isCloseTo(19.0, within(1e-9));
        assertThat(record.gridImportKwh()).isCloseTo(31.0, within(1e-9));
        assertThat(record.renewableKwh()).isEqualTo(30.0);
        assertThat(state.getBatterySoc()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    @DisplayName("Sin red: el déficit pasa al generador y el resto queda sin servir")
    void balance_offGridUsesGeneratorThenUnserved() {
        // --- 1. Arrange ---
        when(dataProvider.dieselPricePerLiter(DAY)).thenReturn(1.5);
        EnergyState state = stateBuilder().gridConnected(false).generatorCapacityKw(50.0).build();

        // --- 2. Act ---
        DailyEnergyRecord record = dispatcher.balance(state, DAY, 2000.0, 0.0, 0.0);

        // --- 3. Assert ---
        assertThat(record.gridImportKwh()).isZero();
        assertThat(record.generatorKwh()).isEqualTo(1200.0);
        assertThat(record.generatorHours()).isEqualTo(24.0);
        assertThat(record.generatorFuelL()).isCloseTo(312.0, within(1e-9));
        assertThat(record.dieselCostUsd()).isCloseTo(468.0, within(1e-9));
        assertThat(record.unservedKwh()).isCloseTo(800.0, within(1e-9));
    }

    @Test
    @DisplayName("Sin red ni batería el excedente se vierte")
    void balance_offGridSurplusIsCurtailed() {
        EnergyState state = stateBuilder().gridConnected(false).build();

        DailyEnergyRecord record = dispatcher.balance(state, DAY, 100.0, 200.0, 0.0);

        assertThat(record.curtailedKwh()).isEqualTo(100.0);
        assertThat(record.gridExportKwh()).isZero();
        verifyNoInteractions(dataProvider);
    }

    @Test
    @DisplayName("Sin generación instalada no se consultan los modelos y la red cubre la demanda")
    void dispatch_zeroCapacities() {
        EnergyState state = stateBuilder().build();

        DailyEnergyRecord record = dispatcher.dispatch(state, DAY, 50.0);

        assertThat(record.gridImportKwh()).isEqualTo(50.0);
        assertThat(record.batterySoc()).isEqualTo(0.5);
        assertThat(state.getDailyRecords()).containsExactly(record);
        verifyNoInteractions(pvModel, windModel, dataProvider);
    }

    @Test
    @DisplayName("Con potencia instalada la generación sale de los modelos")
    void dispatch_usesGenerationModels() {
        when(pvModel.dailyKwh(DAY)).thenReturn(60.0);
        when(windModel.dailyKwh(DAY)).thenReturn(40.0);
        EnergyState state = stateBuilder().pvCapacityKw(10.0).windCapacityKw(10.0).build();

        DailyEnergyRecord record = dispatcher.dispatch(state, DAY, 100.0);

        assertThat(record.pvKwh()).isEqualTo(60.0);
        assertThat(record.windKwh()).isEqualTo(40.0);
        assertThat(record.gridImportKwh()).isZero();
        assertThat(record.gridExportKwh()).isZero();
    }

    @Test
    @DisplayName("Ciclos alternos de excedente y déficit: el cociente descarga/carga tiende a ηc · ηd")
    void balance_alternatingCycles_ratioConvergesToRoundTrip() {
        // --- 1. Arrange ---
        // El SOC inicial por encima de socMin aporta energía extra solo en el primer ciclo
        EnergyState state = stateBuilder().batteryCapacityKwh(100.0).initialSoc(0.6).socMin(0.2).build();
        double charged = 0.0;
        double discharged = 0.0;
        double ratioAfterTenCycles = 0.0;

        // --- 2. Act ---
        LocalDate day = DAY;
        for (int cycle = 1; cycle <= 200; cycle++) {
            DailyEnergyRecord surplus = dispatcher.balance(state, day, 0.0, 30.0, 0.0);
            assertThat(state.getBatterySoc()).isBetween(0.2, 0.9);
            DailyEnergyRecord deficit = dispatcher.balance(state, day.plusDays(1), 100.0, 0.0, 0.0);
            assertThat(state.getBatterySoc()).isBetween(0.2, 0.9);

            charged += surplus.batteryChargeKwh();
            discharged += deficit.batteryDischargeKwh();
            if (cycle == 10) {
                ratioAfterTenCycles = discharged / charged;
            }
            day = day.plusDays(2);
        }

        // --- 3. Assert ---
        double ratio = discharged / charged;
        assertThat(charged).isCloseTo(200 * 30.0, within(1e-6));
        assertThat(ratio).isLessThan(ratioAfterTenCycles);
        assertThat(ratio).isCloseTo(0.95 * 0.95, within(0.01));
        assertThat(ratio).isGreaterThanOrEqualTo(0.95 * 0.95);
    }

    @Test
    @DisplayName("Secuencia pseudoaleatoria: el SOC nunca sale de sus límites y la energía cuadra")
    void balance_randomSequence_keepsSocBoundsAndEnergyBalance() {
        // --- 1. Arrange ---
        Random random = new Random(42L);
        EnergyState state = stateBuilder().batteryCapacityKwh(100.0).initialSoc(0.2).socMin(0.2).build();
        double charged = 0.0;
        double discharged = 0.0;

        // --- 2. Act ---
        for (int i = 0; i < 365; i++) {
            double demand = random.nextDouble() * 200.0;
            double pv = random.nextDouble() * 200.0;
            DailyEnergyRecord record = dispatcher.balance(state, DAY.plusDays(i), demand, pv, 0.0);

            assertThat(state.getBatterySoc()).isBetween(0.2, 0.9);
            assertThat(record.batteryChargeKwh() + record.gridExportKwh() + record.curtailedKwh()
                    - record.batteryDischargeKwh() - record.gridImportKwh())
                    .isCloseTo(pv - demand, within(1e-9));
            charged += record.batteryChargeKwh();
            discharged += record.batteryDischargeKwh();
        }

        // --- 3. Assert ---
        // Lo descargado es lo cargado tras las pérdidas, menos lo que queda almacenado
        double stored = (state.getBatterySoc() - 0.2) * 100.0;
        assertThat(discharged / 0.95).isCloseTo(charged * 0.95 - stored, within(1e-6));
        assertThat(charged).isPositive();
        assertThat(discharged / charged).isLessThanOrEqualTo(0.95 * 0.95 + 1e-9);
        assertThat(state.getBatteryChargeKwh()).isCloseTo(charged, within(1e-6));
        assertThat(state.getBatteryDischargeKwh()).isCloseTo(discharged, within(1e-6));
    }
}
