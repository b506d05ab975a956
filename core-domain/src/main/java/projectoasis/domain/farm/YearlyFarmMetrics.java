package projectoasis.domain.farm;

import lombok.Builder;

import java.util.Map;

/**
 * Instantánea inmutable de los totales anuales de una granja.
 * Los desgloses por cultivo solo incluyen siembras del propio año.
 */
@Builder
public record YearlyFarmMetrics(int year,
                                String farmId,
                                double groundwaterM3,
                                double municipalM3,
                                double waterCostUsd,
                                double waterEnergyKwh,
                                double fertilizerCostUsd,
                                double yieldKg,
                                double freshRevenueUsd,
                                double processedRevenueUsd,
                                double processedOutputKg,
                                double postHarvestLossKg,
                                Map<String, Double> cropWaterM3,
                                Map<String, Double> cropYieldKg,
                                Map<String, Double> cropRevenueUsd) {

    public YearlyFarmMetrics {
        cropWaterM3 = cropWaterM3 == null ? Map.of() : Map.copyOf(cropWaterM3);
        cropYieldKg = cropYieldKg == null ? Map.of() : Map.copyOf(cropYieldKg);
        cropRevenueUsd = cropRevenueUsd == null ? Map.of() : Map.copyOf(cropRevenueUsd);
    }

    public double totalWaterM3() {
        return groundwaterM3 + municipalM3;
    }

    public double totalRevenueUsd() {
        return freshRevenueUsd + processedRevenueUsd;
    }
}
