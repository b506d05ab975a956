package projectoasis.factory;

import lombok.extern.slf4j.Slf4j;
import projectoasis.config.CropScheduleEntry;
import projectoasis.config.FarmConfig;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.data.YieldInfo;
import projectoasis.domain.farm.CropPlanting;
import projectoasis.domain.farm.FarmState;
import projectoasis.exception.ScenarioConfigurationException;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Crea las siembras de un año para una granja a partir de su calendario.
 * <p>
 * Una fecha sin datos de rendimiento no se siembra (se avisa por log). El agua esperada de
 * cada siembra es la suma de su curva de riego entre siembra y cosecha. Al sembrar se carga
 * el coste de fertilizante de la superficie plantada.
 */
@Slf4j
public class CropPlantingFactory {

    private final ISimulationDataProvider dataProvider;

    public CropPlantingFactory(ISimulationDataProvider dataProvider) {
        this.dataProvider = dataProvider;
    }

    public List<CropPlanting> plantYear(FarmState farm, FarmConfig farmConfig, int year) {
        List<CropPlanting> created = new ArrayList<>();
        for (CropScheduleEntry crop : farmConfig.getCrops()) {
            double areaHa = farm.getAreaHa() * crop.areaFraction() * crop.percentPlanted();
            for (MonthDay monthDay : crop.plantingDates()) {
                LocalDate plantingDate = monthDay.atYear(year);
                Optional<YieldInfo> yieldInfo = dataProvider.yieldInfo(crop.cropName(), plantingDate);
                if (yieldInfo.isEmpty()) {
                    log.warn("Granja {}: sin datos de rendimiento para {} sembrado el {}. Se omite la siembra.",
                            farm.getId(), crop.cropName(), plantingDate);
                    continue;
                }
                created.add(createPlanting(crop.cropName(), plantingDate, areaHa,
                        yieldInfo.get(), farmConfig.getYieldFactor()));
            }
        }

        checkOverlaps(farm.getId(), created);

        for (CropPlanting planting : created) {
            farm.addPlanting(planting);
            farm.addFertilizerCost(planting.getAreaHa() * dataProvider.fertilizerCostPerHa(planting.getPlantingDate()));
        }
        return created;
    }

    private CropPlanting createPlanting(String cropName, LocalDate plantingDate, double areaHa,
                                        YieldInfo yieldInfo, double yieldFactor) {
        double expectedWater = 0.0;
        for (LocalDate day = plantingDate; !day.isAfter(yieldInfo.harvestDate()); day = day.plusDays(1)) {
            expectedWater += dataProvider.irrigationM3PerHa(cropName, plantingDate, day) * areaHa;
        }
        return new CropPlanting(cropName, plantingDate, yieldInfo.harvestDate(), areaHa,
                yieldInfo.expectedYieldKgPerHa() * yieldFactor, expectedWater);
    }

    /** Dos siembras del mismo cultivo no pueden ocupar la parcela a la vez. */
    private void checkOverlaps(String farmId, List<CropPlanting> plantings) {
        Map<String, List<CropPlanting>> byCrop = plantings.stream()
                .collect(Collectors.groupingBy(CropPlanting::getCropName));
        for (Map.Entry<String, List<CropPlanting>> entry : byCrop.entrySet()) {
            List<CropPlanting> sorted = entry.getValue().stream()
                    .sorted(Comparator.comparing(CropPlanting::getPlantingDate))
                    .collect(Collectors.toList());
            for (int i = 1; i < sorted.size(); i++) {
                CropPlanting previous = sorted.get(i - 1);
                CropPlanting next = sorted.get(i);
                if (!previous.getHarvestDate().isBefore(next.getPlantingDate())) {
                    throw new ScenarioConfigurationException(String.format(
                            "Granja %s: la siembra de %s del %s (cosecha %s) se solapa con la del %s.",
                            farmId, entry.getKey(), previous.getPlantingDate(), previous.getHarvestDate(),
                            next.getPlantingDate()));
                }
            }
        }
    }
}
