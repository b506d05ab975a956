package projectoasis.domain.simulation;

import lombok.Builder;
import projectoasis.domain.energy.YearlyEnergyMetrics;
import projectoasis.domain.farm.YearlyFarmMetrics;

import java.time.LocalDate;
import java.util.List;

/**
 * Resumen inmutable de una ejecución, pensado para los colaboradores de métricas e informes.
 * Las series diarias completas siguen disponibles en {@link SimulationState}.
 */
@Builder
public record SimulationResult(LocalDate startDate,
                               LocalDate endDate,
                               long daysSimulated,
                               List<YearlyFarmMetrics> yearlyFarmMetrics,
                               List<YearlyEnergyMetrics> yearlyEnergyMetrics,
                               EconomicSummary economics,
                               AquiferSummary aquifer,
                               double finalBatterySoc) {

    public SimulationResult {
        yearlyFarmMetrics = yearlyFarmMetrics == null ? List.of() : List.copyOf(yearlyFarmMetrics);
        yearlyEnergyMetrics = yearlyEnergyMetrics == null ? List.of() : List.copyOf(yearlyEnergyMetrics);
    }

    @Builder
    public record EconomicSummary(double cashReservesUsd,
                                  double cumulativeRevenueUsd,
                                  double cumulativeOperatingCostUsd,
                                  double cumulativeDebtServiceUsd,
                                  double cumulativeInfrastructureCostUsd,
                                  double annualInfrastructureCostUsd) {
    }

    /**
     * @param yearsRemaining {@code null} cuando la explotación es sostenible (+∞ no es JSON válido).
     */
    @Builder
    public record AquiferSummary(double cumulativeExtractionM3,
                                 double netDepletionM3,
                                 double drawdownM,
                                 double effectiveHeadM,
                                 Double yearsRemaining) {
    }
}
