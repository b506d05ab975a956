package projectoasis.domain.farm;

import lombok.Getter;
import projectoasis.domain.water.DailyWaterRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Estado mutable de una granja durante la simulación.
 * <p>
 * Las siembras y los registros diarios son de solo-añadir. Los acumuladores anuales se
 * vuelcan en un {@link YearlyFarmMetrics} y se reinician en cada cambio de año.
 * Invariante: {@code agua total = subterránea + municipal}.
 */
@Getter
public class FarmState {

    private final String id;
    private final String name;
    private final double areaHa;
    private final String waterPolicyName;

    private final List<CropPlanting> plantings = new ArrayList<>();
    private final List<DailyWaterRecord> dailyWaterRecords = new ArrayList<>();
    private final MonthlyConsumptionTracker monthlyTracker = new MonthlyConsumptionTracker();

    // --- Acumuladores del año en curso ---
    private double groundwaterM3;
    private double municipalM3;
    private double waterCostUsd;
    private double waterEnergyKwh;
    private double fertilizerCostUsd;
    private double yieldKg;
    private double freshRevenueUsd;
    private double processedRevenueUsd;
    private double processedOutputKg;
    private double postHarvestLossKg;
    private final Map<String, Double> cropWaterM3 = new LinkedHashMap<>();

    public FarmState(String id, String name, double areaHa, String waterPolicyName) {
        this.id = id;
        this.name = name;
        this.areaHa = areaHa;
        this.waterPolicyName = waterPolicyName;
    }

    public void addPlanting(CropPlanting planting) {
        plantings.add(planting);
    }

    public List<CropPlanting> getPlantings() {
        return Collections.unmodifiableList(plantings);
    }

    public List<DailyWaterRecord> getDailyWaterRecords() {
        return Collections.unmodifiableList(dailyWaterRecords);
    }

    public List<CropPlanting> activePlantings(LocalDate date) {
        return plantings.stream().filter(p -> p.isActiveOn(date)).collect(Collectors.toList());
    }

    public List<CropPlanting> plantingsDueForHarvest(LocalDate date) {
        return plantings.stream().filter(p -> p.isHarvestDue(date)).collect(Collectors.toList());
    }

    /**
     * Incorpora la asignación del día a los acumuladores anuales y al contador mensual.
     */
    public void recordWaterDelivery(DailyWaterRecord record) {
        groundwaterM3 += record.groundwaterM3();
        municipalM3 += record.municipalM3();
        waterCostUsd += record.costUsd();
        waterEnergyKwh += record.energyKwh();
        monthlyTracker.record(record.date(), record.groundwaterM3());
        dailyWaterRecords.add(record);
    }

    /** Abona a una siembra el agua entregada y la suma al desglose anual de su cultivo. */
    public void creditPlantingWater(CropPlanting planting, double volumeM3) {
        planting.addWater(volumeM3);
        cropWaterM3.merge(planting.getCropName(), volumeM3, Double::sum);
    }

    public void recordHarvest(CropPlanting planting, HarvestOutcome outcome) {
        planting.markHarvested(outcome);
        yieldKg += outcome.yieldKg();
        freshRevenueUsd += outcome.freshRevenueUsd();
        processedRevenueUsd += outcome.processedRevenueUsd();
        processedOutputKg += outcome.processedOutputKg();
        postHarvestLossKg += outcome.postHarvestLossKg();
    }

    public void addFertilizerCost(double costUsd) {
        fertilizerCostUsd += costUsd;
    }

    public double getTotalWaterM3() {
        return groundwaterM3 + municipalM3;
    }

    public double getTotalRevenueUsd() {
        return freshRevenueUsd + processedRevenueUsd;
    }

    public double groundwaterThisMonth(LocalDate date) {
        return monthlyTracker.groundwaterFor(date);
    }

    public YearlyFarmMetrics snapshotYear(int year) {
        Map<String, Double> cropYield = new LinkedHashMap<>();
        Map<String, Double> cropRevenue = new LinkedHashMap<>();
        for (CropPlanting planting : plantings) {
            if (planting.getPlantingDate().getYear() != year) {
                continue;
            }
            planting.harvestOutcome().ifPresent(outcome -> {
                cropYield.merge(planting.getCropName(), outcome.yieldKg(), Double::sum);
                cropRevenue.merge(planting.getCropName(), outcome.totalRevenueUsd(), Double::sum);
            });
        }
        return YearlyFarmMetrics.builder()
                .year(year)
                .farmId(id)
                .groundwaterM3(groundwaterM3)
                .municipalM3(municipalM3)
                .waterCostUsd(waterCostUsd)
                .waterEnergyKwh(waterEnergyKwh)
                .fertilizerCostUsd(fertilizerCostUsd)
                .yieldKg(yieldKg)
                .freshRevenueUsd(freshRevenueUsd)
                .processedRevenueUsd(processedRevenueUsd)
                .processedOutputKg(processedOutputKg)
                .postHarvestLossKg(postHarvestLossKg)
                .cropWaterM3(cropWaterM3)
                .cropYieldKg(cropYield)
                .cropRevenueUsd(cropRevenue)
                .build();
    }

    /** Reinicia los acumuladores anuales. Las siembras y los registros diarios se conservan. */
    public void resetYearlyAccumulators() {
        groundwaterM3 = 0.0;
        municipalM3 = 0.0;
        waterCostUsd = 0.0;
        waterEnergyKwh = 0.0;
        fertilizerCostUsd = 0.0;
        yieldKg = 0.0;
        freshRevenueUsd = 0.0;
        processedRevenueUsd = 0.0;
        processedOutputKg = 0.0;
        postHarvestLossKg = 0.0;
        cropWaterM3.clear();
    }
}
