package projectoasis.data.memory;

import lombok.extern.slf4j.Slf4j;
import projectoasis.config.PvDensity;
import projectoasis.data.CommunityDemand;
import projectoasis.data.DailySeries;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.data.YieldInfo;
import projectoasis.domain.farm.ProcessingPathway;
import projectoasis.exception.MissingDataException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Proveedor de datos respaldado por tablas en memoria, cargadas una vez antes de simular.
 * <p>
 * Las curvas de riego se indexan por días desde la siembra: fuera de la curva la demanda es cero.
 * Es de solo lectura una vez poblado, así que puede compartirse entre ejecuciones independientes.
 */
@Slf4j
public class InMemoryDataProvider implements ISimulationDataProvider {

    private record PlantingKey(String crop, LocalDate plantingDate) {
    }

    private record ProcessingFactors(double weightLoss, double postHarvestLoss, double valueMultiplier) {
    }

    private final Map<PlantingKey, double[]> irrigationCurves = new HashMap<>();
    private final Map<PlantingKey, YieldInfo> yields = new HashMap<>();
    private final Map<String, Double> yieldResponseFactors = new HashMap<>();
    private final Map<String, Map<ProcessingPathway, ProcessingFactors>> processingByCrop = new HashMap<>();
    private final Map<ProcessingPathway, ProcessingFactors> defaultProcessing = new EnumMap<>(ProcessingPathway.class);
    private final Map<PvDensity, DailySeries> pvSeries = new EnumMap<>(PvDensity.class);
    private final Map<String, DailySeries> windSeries = new HashMap<>();
    private final NavigableMap<LocalDate, CommunityDemand> communityDemand = new TreeMap<>();
    private final Map<String, Double> treatmentEnergy = new HashMap<>();
    private final Map<String, DailySeries> cropPrices = new HashMap<>();
    private final Map<String, Double> referencePrices = new HashMap<>();
    private DailySeries dieselPrice;
    private DailySeries fertilizerCost;

    // --- Registro de tablas ---

    public InMemoryDataProvider withIrrigationCurve(String crop, LocalDate plantingDate, double[] m3PerHaByDay) {
        irrigationCurves.put(new PlantingKey(crop, plantingDate), m3PerHaByDay.clone());
        log.debug("Curva de riego registrada: {} sembrado el {} ({} días).", crop, plantingDate, m3PerHaByDay.length);
        return this;
    }

    public InMemoryDataProvider withYield(String crop, LocalDate plantingDate, double kgPerHa, LocalDate harvestDate) {
        yields.put(new PlantingKey(crop, plantingDate), new YieldInfo(kgPerHa, harvestDate));
        return this;
    }

    public InMemoryDataProvider withYieldResponseFactor(String crop, double ky) {
        yieldResponseFactors.put(crop, ky);
        return this;
    }

    public InMemoryDataProvider withProcessingFactors(String crop, ProcessingPathway pathway,
                                                      double weightLoss, double postHarvestLoss,
                                                      double valueMultiplier) {
        processingByCrop.computeIfAbsent(crop, c -> new EnumMap<>(ProcessingPathway.class))
                .put(pathway, new ProcessingFactors(weightLoss, postHarvestLoss, valueMultiplier));
        return this;
    }

    /** Factores aplicados a cualquier cultivo sin valores propios para la vía. */
    public InMemoryDataProvider withDefaultProcessingFactors(ProcessingPathway pathway, double weightLoss,
                                                             double postHarvestLoss, double valueMultiplier) {
        defaultProcessing.put(pathway, new ProcessingFactors(weightLoss, postHarvestLoss, valueMultiplier));
        return this;
    }

    public InMemoryDataProvider withPvSeries(PvDensity density, DailySeries kwhPerKw) {
        pvSeries.put(density, kwhPerKw);
        return this;
    }

    public InMemoryDataProvider withWindSeries(String turbineType, DailySeries kwhPerKw) {
        windSeries.put(turbineType, kwhPerKw);
        return this;
    }

    /** La demanda registrada rige desde {@code from} hasta el siguiente registro. */
    public InMemoryDataProvider withCommunityDemand(LocalDate from, CommunityDemand demand) {
        communityDemand.put(from, demand);
        return this;
    }

    public InMemoryDataProvider withTreatmentEnergy(String salinityLevel, double kwhPerM3) {
        treatmentEnergy.put(salinityLevel, kwhPerM3);
        return this;
    }

    public InMemoryDataProvider withCropPrice(String crop, DailySeries pricePerKg) {
        cropPrices.put(crop, pricePerKg);
        return this;
    }

    public InMemoryDataProvider withReferencePrice(String crop, double pricePerKg) {
        referencePrices.put(crop, pricePerKg);
        return this;
    }

    public InMemoryDataProvider withDieselPrice(DailySeries pricePerLiter) {
        this.dieselPrice = pricePerLiter;
        return this;
    }

    public InMemoryDataProvider withFertilizerCost(DailySeries costPerHa) {
        this.fertilizerCost = costPerHa;
        return this;
    }

    // --- Consultas ---

    @Override
    public double irrigationM3PerHa(String cropName, LocalDate plantingDate, LocalDate date) {
        double[] curve = irrigationCurves.get(new PlantingKey(cropName, plantingDate));
        if (curve == null) {
            throw new MissingDataException("Sin curva de riego para " + cropName + " sembrado el " + plantingDate);
        }
        long dayIndex = ChronoUnit.DAYS.between(plantingDate, date);
        if (dayIndex < 0 || dayIndex >= curve.length) {
            return 0.0;
        }
        return curve[(int) dayIndex];
    }

    @Override
    public Optional<YieldInfo> yieldInfo(String cropName, LocalDate plantingDate) {
        return Optional.ofNullable(yields.get(new PlantingKey(cropName, plantingDate)));
    }

    @Override
    public double yieldResponseFactor(String cropName) {
        Double ky = yieldResponseFactors.get(cropName);
        if (ky == null) {
            throw new MissingDataException("Sin coeficiente Ky para " + cropName);
        }
        return ky;
    }

    @Override
    public double weightLossFraction(String cropName, ProcessingPathway pathway) {
        return processingFactors(cropName, pathway).weightLoss();
    }

    @Override
    public double postHarvestLossFraction(String cropName, ProcessingPathway pathway) {
        return processingFactors(cropName, pathway).postHarvestLoss();
    }

    @Override
    public double valueMultiplier(String cropName, ProcessingPathway pathway) {
        return processingFactors(cropName, pathway).valueMultiplier();
    }

    private ProcessingFactors processingFactors(String cropName, ProcessingPathway pathway) {
        ProcessingFactors factors = processingByCrop.getOrDefault(cropName, Map.of()).get(pathway);
        if (factors == null) {
            factors = defaultProcessing.get(pathway);
        }
        if (factors == null) {
            throw new MissingDataException("Sin factores de procesado para " + cropName + "/" + pathway.getCode());
        }
        return factors;
    }

    @Override
    public double pvKwhPerKw(LocalDate date, PvDensity density) {
        DailySeries series = pvSeries.get(density);
        if (series == null) {
            throw new MissingDataException("Sin serie PV para densidad " + density.getCode());
        }
        return series.valueAt(date);
    }

    @Override
    public double windKwhPerKw(LocalDate date, String turbineType) {
        DailySeries series = windSeries.get(turbineType);
        if (series == null) {
            throw new MissingDataException("Sin serie eólica para turbina " + turbineType);
        }
        return series.valueAt(date);
    }

    @Override
    public CommunityDemand communityDemand(LocalDate date) {
        Map.Entry<LocalDate, CommunityDemand> entry = communityDemand.floorEntry(date);
        if (entry == null) {
            throw new MissingDataException("Sin demanda comunitaria para el " + date);
        }
        return entry.getValue();
    }

    @Override
    public double treatmentKwhPerM3(String salinityLevel) {
        Double kwh = treatmentEnergy.get(salinityLevel);
        if (kwh == null) {
            throw new MissingDataException("Sin energía de tratamiento para salinidad " + salinityLevel);
        }
        return kwh;
    }

    @Override
    public double cropPricePerKg(String cropName, LocalDate date) {
        DailySeries series = cropPrices.get(cropName);
        if (series == null) {
            throw new MissingDataException("Sin precios para el cultivo " + cropName);
        }
        return series.valueAt(date);
    }

    @Override
    public double dieselPricePerLiter(LocalDate date) {
        if (dieselPrice == null) {
            throw new MissingDataException("Sin precios de diésel.");
        }
        return dieselPrice.valueAt(date);
    }

    @Override
    public double fertilizerCostPerHa(LocalDate date) {
        if (fertilizerCost == null) {
            throw new MissingDataException("Sin costes de fertilizante.");
        }
        return fertilizerCost.valueAt(date);
    }

    @Override
    public Optional<Double> referenceCropPrice(String cropName) {
        return Optional.ofNullable(referencePrices.get(cropName));
    }
}
