package projectoasis.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.domain.farm.CropPlanting;
import projectoasis.domain.farm.FarmState;
import projectoasis.domain.farm.HarvestOutcome;
import projectoasis.domain.farm.ProcessingPathway;
import projectoasis.domain.farm.ProcessingSplit;
import projectoasis.physics.model.WaterStressYieldModel;
import projectoasis.policy.food.FoodProcessingContext;
import projectoasis.policy.i.IFoodProcessingPolicy;

import java.time.LocalDate;

/**
 * Cosecha las siembras que alcanzan su fecha: aplica el estrés hídrico, reparte la cosecha
 * entre vías de procesado y valora cada vía tras sus pérdidas.
 * <p>
 * Por vía: {@code bruto = cosecha · fracción}, {@code salida = bruto · (1 − pérdida de peso)},
 * {@code vendible = salida · (1 − pérdida postcosecha)},
 * {@code ingreso = vendible · precio fresco · multiplicador de valor}.
 */
@Slf4j
public class HarvestProcessor {

    private final ISimulationDataProvider dataProvider;
    private final WaterStressYieldModel yieldModel;

    public HarvestProcessor(ISimulationDataProvider dataProvider, WaterStressYieldModel yieldModel) {
        this.dataProvider = dataProvider;
        this.yieldModel = yieldModel;
    }

    public void processHarvests(FarmState farm, LocalDate date, IFoodProcessingPolicy foodPolicy) {
        for (CropPlanting planting : farm.plantingsDueForHarvest(date)) {
            HarvestOutcome outcome = harvest(planting, date, foodPolicy);
            farm.recordHarvest(planting, outcome);
            log.debug("{} [{}] cosecha {} del {}: {} kg, estrés {}, ingreso {} USD.", date, farm.getId(),
                    planting.getCropName(), planting.getPlantingDate(),
                    String.format("%.1f", outcome.yieldKg()), String.format("%.3f", outcome.stressFactor()),
                    String.format("%.2f", outcome.totalRevenueUsd()));
        }
    }

    public HarvestOutcome harvest(CropPlanting planting, LocalDate date, IFoodProcessingPolicy foodPolicy) {
        String crop = planting.getCropName();
        double ky = dataProvider.yieldResponseFactor(crop);
        double received = planting.getCumulativeWaterM3();
        double expected = planting.getExpectedTotalWaterM3();
        double waterRatio = yieldModel.waterRatio(received, expected);
        double stress = yieldModel.stressFactor(waterRatio, ky);
        double yieldKg = yieldModel.harvestYieldKg(planting.getExpectedTotalYieldKg(), received, expected, ky);

        double freshPrice = dataProvider.cropPricePerKg(crop, date);
        Double referencePrice = dataProvider.referenceCropPrice(crop).orElse(null);
        ProcessingSplit split = foodPolicy.allocate(new FoodProcessingContext(crop, yieldKg, freshPrice, referencePrice));

        double freshRevenue = 0.0;
        double processedRevenue = 0.0;
        double processedOutput = 0.0;
        double loss = 0.0;
        for (ProcessingPathway pathway : ProcessingPathway.values()) {
            double fraction = split.fractionFor(pathway);
            if (fraction <= 0) {
                continue;
            }
            double raw = yieldKg * fraction;
            double output = raw * (1.0 - dataProvider.weightLossFraction(crop, pathway));
            double sellable = output * (1.0 - dataProvider.postHarvestLossFraction(crop, pathway));
            double revenue = sellable * freshPrice * dataProvider.valueMultiplier(crop, pathway);
            loss += raw - sellable;

            if (pathway.isProcessed()) {
                processedRevenue += revenue;
                processedOutput += output;
            } else {
                freshRevenue += revenue;
            }
        }

        return HarvestOutcome.builder()
                .yieldKg(yieldKg)
                .waterRatio(waterRatio)
                .stressFactor(stress)
                .freshPricePerKg(freshPrice)
                .freshRevenueUsd(freshRevenue)
                .processedRevenueUsd(processedRevenue)
                .processedOutputKg(processedOutput)
                .postHarvestLossKg(loss)
                .split(split)
                .build();
    }
}
