package projectoasis.economics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectoasis.config.BatteryConfig;
import projectoasis.config.FinancingStatus;
import projectoasis.config.FoodProcessingLineConfig;
import projectoasis.config.GeneratorConfig;
import projectoasis.config.InfrastructureConfig;
import projectoasis.config.IrrigationSystemConfig;
import projectoasis.config.PvConfig;
import projectoasis.config.PvDensity;
import projectoasis.config.ReferenceCosts;
import projectoasis.config.WellConfig;
import projectoasis.config.WindConfig;
import projectoasis.domain.economics.SubsystemCost;
import projectoasis.domain.farm.ProcessingPathway;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InfrastructureCostEstimatorTest {

    private final InfrastructureCostEstimator estimator =
            new InfrastructureCostEstimator(ReferenceCosts.defaults(), new FinancingCalculator());

    @Test
    @DisplayName("Cada subsistema instalado aparece con su perfil; los de capacidad cero se omiten")
    void estimate_skipsZeroCapacitySubsystems() {
        // --- 1. Arrange ---
        InfrastructureConfig infra = InfrastructureConfig.builder()
                .wells(new WellConfig(2, 50.0, 100.0, FinancingStatus.LOAN_STANDARD))
                .irrigation(new IrrigationSystemConfig("drip", FinancingStatus.EXISTING_OWNED))
                .pv(new PvConfig(100.0, PvDensity.MEDIUM, FinancingStatus.PURCHASED_CASH))
                .wind(new WindConfig(0.0, "small", FinancingStatus.PURCHASED_CASH))
                .battery(BatteryConfig.builder().capacityKwh(0.0).build())
                .generator(GeneratorConfig.builder().capacityKw(0.0).build())
                .processingLine(new FoodProcessingLineConfig(ProcessingPathway.DRIED, 2, FinancingStatus.GRANT_FULL))
                .build();

        // --- 2. Act ---
        Map<String, SubsystemCost> costs = estimator.estimate(infra, 10.0).stream()
                .collect(Collectors.toMap(SubsystemCost::subsystem, Function.identity()));

        // --- 3. Assert ---
        assertThat(costs).containsOnlyKeys("wells", "irrigation", "pv", "processing_dried");

        // 2 pozos · 50 m · 150 USD/m
        assertThat(costs.get("wells").capitalCostUsd()).isEqualTo(15_000.0);
        assertThat(costs.get("wells").annualOpexUsd()).isEqualTo(3_000.0);
        assertThat(costs.get("wells").annualDebtServiceUsd()).isPositive();

        // 10 ha · 3000 USD/ha, O&M del 3 %
        assertThat(costs.get("irrigation").capitalCostUsd()).isEqualTo(30_000.0);
        assertThat(costs.get("irrigation").annualOpexUsd()).isEqualTo(900.0);

        // 100 kW · 800 USD/kW amortizados a 15 años
        assertThat(costs.get("pv").annualCapexUsd()).isCloseTo(5_333.33, within(1e-6));
        assertThat(costs.get("pv").annualOpexUsd()).isEqualTo(1_500.0);

        assertThat(costs.get("processing_dried").capitalCostUsd()).isEqualTo(60_000.0);
        assertThat(costs.get("processing_dried").totalAnnualUsd()).isZero();
    }

    @Test
    @DisplayName("Una infraestructura vacía no genera costes")
    void estimate_emptyInfrastructure() {
        InfrastructureConfig infra = InfrastructureConfig.builder()
                .battery(BatteryConfig.builder().capacityKwh(0.0).build())
                .generator(GeneratorConfig.builder().capacityKw(0.0).build())
                .build();

        List<SubsystemCost> costs = estimator.estimate(infra, 0.0);

        assertThat(costs).isEmpty();
    }
}
