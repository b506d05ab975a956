package projectoasis.physics.simulator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectoasis.config.AquiferConfig;
import projectoasis.config.BatteryConfig;
import projectoasis.config.CropScheduleEntry;
import projectoasis.config.ElectricityTariff;
import projectoasis.config.FarmConfig;
import projectoasis.config.FinancingStatus;
import projectoasis.config.GeneratorConfig;
import projectoasis.config.InfrastructureConfig;
import projectoasis.config.PricingConfig;
import projectoasis.config.PvConfig;
import projectoasis.config.PvDensity;
import projectoasis.config.ScenarioConfig;
import projectoasis.config.StorageConfig;
import projectoasis.config.TreatmentConfig;
import projectoasis.config.WaterPolicySpec;
import projectoasis.config.WaterTariff;
import projectoasis.config.WellConfig;
import projectoasis.config.WindConfig;
import projectoasis.data.CommunityDemand;
import projectoasis.data.DailySeries;
import projectoasis.data.memory.InMemoryDataProvider;
import projectoasis.domain.energy.YearlyEnergyMetrics;
import projectoasis.domain.farm.ProcessingPathway;
import projectoasis.domain.farm.YearlyFarmMetrics;
import projectoasis.domain.simulation.SimulationResult;
import projectoasis.domain.water.DailyStorageRecord;
import projectoasis.domain.water.DailyWaterRecord;
import projectoasis.exception.ScenarioConfigurationException;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Pruebas de extremo a extremo del bucle diario.
 * <p>
 * Escenario base: 10 ha de tomate sembradas el 1 de enero y cosechadas el 31 de marzo
 * (90 días a 10 m³/ha/día = 9000 m³), energía a coste cero, O&amp;M de 0.30 USD/m³,
 * sin renovables y con capacidad de pozos y tratamiento sobrada.
 */
class DailySimulatorTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 1);
    private static final LocalDate END = LocalDate.of(2025, 3, 31);

    private static InMemoryDataProvider provider() {
        double[] curve = new double[90];
        Arrays.fill(curve, 10.0);
        return new InMemoryDataProvider()
                .withIrrigationCurve("tomato", START, curve)
                .withYield("tomato", START, 50_000.0, END)
                .withYieldResponseFactor("tomato", 1.05)
                .withDefaultProcessingFactors(ProcessingPathway.FRESH, 0.0, 0.0, 1.0)
                .withCropPrice("tomato", DailySeries.constant("tomato", 0.50))
                .withCommunityDemand(LocalDate.of(2020, 1, 1), CommunityDemand.NONE)
                .withTreatmentEnergy("low", 1.0)
                .withFertilizerCost(DailySeries.constant("fertilizer", 100.0))
                .withPvSeries(PvDensity.MEDIUM, DailySeries.constant("pv", 1.0));
    }

    private static InfrastructureConfig.InfrastructureConfigBuilder infrastructure() {
        return InfrastructureConfig.builder()
                .wells(new WellConfig(10, 50.0, 10_000.0, FinancingStatus.EXISTING_OWNED))
                .treatment(new TreatmentConfig(100_000.0, "low", FinancingStatus.EXISTING_OWNED))
                .storage(new StorageConfig(1_000.0, FinancingStatus.EXISTING_OWNED))
                .pv(new PvConfig(0.0, PvDensity.MEDIUM, FinancingStatus.EXISTING_OWNED))
                .wind(new WindConfig(0.0, "small", FinancingStatus.EXISTING_OWNED))
                .battery(BatteryConfig.builder().capacityKwh(0.0).build())
                .generator(GeneratorConfig.builder().capacityKw(0.0).build());
    }

    private static ScenarioConfig.ScenarioConfigBuilder scenario(String waterPolicy) {
        return ScenarioConfig.builder()
                .startDate(START)
                .endDate(END)
                .infrastructure(infrastructure().build())
                .pricing(PricingConfig.builder()
                        .agriculturalWater(WaterTariff.flat(1.00))
                        .domesticWater(WaterTariff.flat(1.00))
                        .agriculturalElectricity(ElectricityTariff.flat(0.0))
                        .domesticElectricity(ElectricityTariff.flat(0.0))
                        .build())
                .aquifer(new AquiferConfig(10_000_000.0, 0.0, 50.0))
                .groundwaterMaintenancePerM3(0.30)
                .farm(FarmConfig.builder()
                        .id("farm_1")
                        .name("Granja 1")
                        .areaHa(10.0)
                        .startingCapitalUsd(100_000.0)
                        .crop(new CropScheduleEntry("tomato", 1.0, List.of(MonthDay.of(1, 1)), 1.0))
                        .waterPolicy(WaterPolicySpec.of(waterPolicy))
                        .build());
    }

    @Test
    @DisplayName("always_groundwater con capacidad sobrada: cero municipal y cosecha completa")
    void run_alwaysGroundwater() {
        // --- 1. Arrange ---
        DailySimulator simulator = new DailySimulator(scenario("always_groundwater").build(), provider());

        // --- 2. Act ---
        SimulationResult result = simulator.run();

        // --- 3. Assert ---
        assertThat(result.daysSimulated()).isEqualTo(90);
        assertThat(result.yearlyFarmMetrics()).hasSize(1);
        YearlyFarmMetrics farm = result.yearlyFarmMetrics().get(0);
        assertThat(farm.year()).isEqualTo(2025);
        assertThat(farm.municipalM3()).isZero();
        assertThat(farm.groundwaterM3()).isCloseTo(9_000.0, within(1e-6));
        assertThat(farm.waterCostUsd()).isCloseTo(2_700.0, within(1e-6));
        assertThat(farm.fertilizerCostUsd()).isCloseTo(1_000.0, within(1e-9));
        assertThat(farm.yieldKg()).isCloseTo(500_000.0, within(1e-3));
        assertThat(farm.freshRevenueUsd()).isCloseTo(250_000.0, within(1e-3));
        assertThat(farm.cropWaterM3().get("tomato")).isCloseTo(9_000.0, within(1e-6));

        assertThat(result.aquifer().cumulativeExtractionM3()).isCloseTo(9_000.0, within(1e-6));
        YearlyEnergyMetrics energy = result.yearlyEnergyMetrics().get(0);
        assertThat(energy.gridImportKwh()).isCloseTo(farm.waterEnergyKwh(), within(1e-6));
        assertThat(energy.unservedKwh()).isZero();

        List<DailyWaterRecord> records = simulator.getState().getFarms().get(0).getDailyWaterRecords();
        assertThat(records).hasSize(90);
        assertThat(records).allSatisfy(r -> {
            assertThat(r.decisionReason()).isEqualTo("gw_preferred");
            assertThat(r.groundwaterM3() + r.municipalM3()).isCloseTo(r.demandM3(), within(1e-9));
        });
    }

    @Test
    @DisplayName("always_municipal: ni extracción ni energía de tratamiento")
    void run_alwaysMunicipal() {
        DailySimulator simulator = new DailySimulator(scenario("always_municipal").build(), provider());

        SimulationResult result = simulator.run();

        YearlyFarmMetrics farm = result.yearlyFarmMetrics().get(0);
        assertThat(result.aquifer().cumulativeExtractionM3()).isZero();
        assertThat(farm.groundwaterM3()).isZero();
        assertThat(farm.municipalM3()).isCloseTo(9_000.0, within(1e-6));
        assertThat(farm.waterEnergyKwh()).isZero();
        assertThat(farm.waterCostUsd()).isCloseTo(9_000.0, within(1e-6));
        assertThat(result.yearlyEnergyMetrics().get(0).demandKwh()).isZero();
        assertThat(farm.yieldKg()).isCloseTo(500_000.0, within(1e-3));
    }

    @Test
    @DisplayName("Pozos sin caudal: la red municipal cubre toda la demanda y la cosecha no sufre")
    void run_noWellCapacity_fallsBackToMunicipal() {
        ScenarioConfig config = scenario("always_groundwater")
                .infrastructure(infrastructure()
                        .wells(new WellConfig(0, 50.0, 0.0, FinancingStatus.EXISTING_OWNED))
                        .build())
                .build();

        SimulationResult result = new DailySimulator(config, provider()).run();

        YearlyFarmMetrics farm = result.yearlyFarmMetrics().get(0);
        assertThat(farm.groundwaterM3()).isZero();
        assertThat(farm.municipalM3()).isCloseTo(9_000.0, within(1e-6));
        assertThat(farm.yieldKg()).isCloseTo(500_000.0, within(1e-3));
        assertThat(result.aquifer().cumulativeExtractionM3()).isZero();
    }

    @Test
    @DisplayName("Un depósito menor que la demanda diaria registra igualmente todo el caudal tratado")
    void run_smallStorage_recordsFullDailyThroughput() {
        // ARRANGE
        ScenarioConfig config = scenario("always_groundwater")
                .infrastructure(infrastructure()
                        .storage(new StorageConfig(50.0, FinancingStatus.EXISTING_OWNED))
                        .build())
                .build();
        DailySimulator simulator = new DailySimulator(config, provider());

        // ACT
        simulator.run();

        // ASSERT
        List<DailyStorageRecord> records = simulator.getState().getStorageRecords();
        assertThat(records).hasSize(90);
        assertThat(records).allSatisfy(r -> {
            assertThat(r.inflowM3()).isCloseTo(100.0, within(1e-9));
            assertThat(r.outflowM3()).isCloseTo(100.0, within(1e-9));
            assertThat(r.irrigationM3()).isCloseTo(100.0, within(1e-9));
            assertThat(r.levelM3()).isBetween(0.0, 50.0);
        });
    }

    @Test
    @DisplayName("El cambio de año conserva el SOC y la extracción acumulada")
    void run_yearBoundaryKeepsSocAndAquifer() {
        // --- 1. Arrange ---
        // 10 kW PV · 1 kWh/kW · 0.90 de sombreado = 9 kWh/día; 1 m³/día doméstico a 1 kWh/m³
        LocalDate start = LocalDate.of(2025, 12, 1);
        LocalDate end = LocalDate.of(2026, 1, 31);
        InMemoryDataProvider provider = provider()
                .withCommunityDemand(start, new CommunityDemand(0.0, 0.0, 1.0, 0.0));
        ScenarioConfig config = scenario("cheapest_source")
                .startDate(start)
                .endDate(end)
                .pvDegradationRate(0.0)
                .infrastructure(infrastructure()
                        .pv(new PvConfig(10.0, PvDensity.MEDIUM, FinancingStatus.EXISTING_OWNED))
                        .battery(BatteryConfig.builder().capacityKwh(10_000.0).build())
                        .build())
                .clearFarms()
                .farm(FarmConfig.builder()
                        .id("farm_1")
                        .name("Granja 1")
                        .areaHa(10.0)
                        .waterPolicy(WaterPolicySpec.of("cheapest_source"))
                        .build())
                .build();
        double dailySocGain = (9.0 - 1.0) * 0.95 / 10_000.0;

        // --- 2. Act ---
        SimulationResult result = new DailySimulator(config, provider).run();

        // --- 3. Assert ---
        assertThat(result.yearlyEnergyMetrics()).extracting(YearlyEnergyMetrics::year).containsExactly(2025, 2026);
        assertThat(result.yearlyEnergyMetrics().get(0).endOfYearSoc()).isCloseTo(0.5 + 31 * dailySocGain, within(1e-9));
        assertThat(result.finalBatterySoc()).isCloseTo(0.5 + 62 * dailySocGain, within(1e-9));
        assertThat(result.yearlyEnergyMetrics().get(1).pvKwh()).isCloseTo(31 * 9.0, within(1e-9));
        assertThat(result.aquifer().cumulativeExtractionM3()).isCloseTo(62.0, within(1e-9));
        assertThat(result.yearlyFarmMetrics()).extracting(YearlyFarmMetrics::year).containsExactly(2025, 2026);
    }

    @Test
    @DisplayName("Una política desconocida falla en el constructor, antes de simular")
    void constructor_unknownPolicyFailsFast() {
        ScenarioConfig config = scenario("pray_for_rain").build();

        assertThatThrownBy(() -> new DailySimulator(config, provider()))
                .isInstanceOf(ScenarioConfigurationException.class)
                .hasMessageContaining("pray_for_rain");
    }

    @Test
    @DisplayName("Un simulador solo se ejecuta una vez")
    void run_twiceIsRejected() {
        DailySimulator simulator = new DailySimulator(scenario("always_municipal").build(), provider());
        simulator.run();

        assertThatThrownBy(simulator::run).isInstanceOf(IllegalStateException.class);
    }
}
