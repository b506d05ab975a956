package projectoasis.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import projectoasis.domain.farm.ProcessingPathway;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;

/**
 * Contenedor principal de la configuración de un escenario.
 * Agrupa el periodo simulado, la infraestructura compartida, las tarifas, el acuífero
 * y las granjas, junto con las constantes globales del modelo.
 */
@Value
@Builder
@With
public class ScenarioConfig {

    /** Primer día simulado (inclusive). */
    LocalDate startDate;

    /** Último día simulado (inclusive). */
    LocalDate endDate;

    InfrastructureConfig infrastructure;

    PricingConfig pricing;

    AquiferConfig aquifer;

    @Singular
    List<FarmConfig> farms;

    /** Coste fijo de operación y mantenimiento por m³ extraído [USD/m³]. */
    @Builder.Default
    double groundwaterMaintenancePerM3 = 0.05;

    /** Energía de conducción desde la planta hasta las parcelas [kWh/m³]. */
    @Builder.Default
    double conveyanceKwhPerM3 = 0.2;

    /** Degradación anual de los paneles PV (fracción). */
    @Builder.Default
    double pvDegradationRate = 0.005;

    @Builder.Default
    ReferenceCosts referenceCosts = ReferenceCosts.defaults();

    /**
     * Escenario de referencia para pruebas: una comunidad de dos granjas con pozos,
     * desalinización, PV, eólica, baterías, generador y conexión a red, durante dos años.
     */
    public static ScenarioConfig getTestingScenario() {
        InfrastructureConfig infrastructure = InfrastructureConfig.builder()
                .wells(new WellConfig(4, 50.0, 100.0, FinancingStatus.EXISTING_OWNED))
                .treatment(new TreatmentConfig(400.0, "moderate", FinancingStatus.LOAN_STANDARD))
                .storage(new StorageConfig(1_000.0, FinancingStatus.EXISTING_OWNED))
                .irrigation(new IrrigationSystemConfig("drip", FinancingStatus.GRANT_CAPEX))
                .pv(new PvConfig(200.0, PvDensity.MEDIUM, FinancingStatus.LOAN_CONCESSIONAL))
                .wind(new WindConfig(50.0, "small", FinancingStatus.PURCHASED_CASH))
                .battery(BatteryConfig.builder().capacityKwh(500.0).build())
                .generator(GeneratorConfig.builder().capacityKw(100.0).build())
                .processingLine(new FoodProcessingLineConfig(
                        ProcessingPathway.DRIED, 1, FinancingStatus.GRANT_FULL))
                .build();

        PricingConfig pricing = PricingConfig.builder()
                .agriculturalWater(new WaterTariff(PricingRegime.UNSUBSIDIZED, 0.40, 0.75, 3.0))
                .domesticWater(WaterTariff.flat(0.50))
                .agriculturalElectricity(new ElectricityTariff(PricingRegime.SUBSIDIZED, 0.08, 0.15, 0.0))
                .domesticElectricity(ElectricityTariff.flat(0.12))
                .build();

        CropScheduleEntry tomato = new CropScheduleEntry("tomato", 0.5,
                List.of(MonthDay.of(2, 1)), 1.0);
        CropScheduleEntry potato = new CropScheduleEntry("potato", 0.5,
                List.of(MonthDay.of(3, 15)), 1.0);

        return ScenarioConfig.builder()
                .startDate(LocalDate.of(2025, 1, 1))
                .endDate(LocalDate.of(2026, 12, 31))
                .infrastructure(infrastructure)
                .pricing(pricing)
                .aquifer(new AquiferConfig(5_000_000.0, 50_000.0, 20.0))
                .farm(FarmConfig.builder()
                        .id("farm_1").name("Granja Norte").areaHa(20.0).startingCapitalUsd(50_000.0)
                        .crop(tomato).crop(potato)
                        .waterPolicy(WaterPolicySpec.of("cheapest_source"))
                        .foodPolicy(FoodPolicySpec.of("balanced_mix"))
                        .build())
                .farm(FarmConfig.builder()
                        .id("farm_2").name("Granja Sur").areaHa(10.0).startingCapitalUsd(25_000.0)
                        .crop(tomato)
                        .waterPolicy(WaterPolicySpec.of("always_groundwater"))
                        .build())
                .build();
    }
}
