package projectoasis.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectoasis.config.FarmConfig;
import projectoasis.config.InfrastructureConfig;
import projectoasis.config.ScenarioConfig;
import projectoasis.config.ScenarioValidator;
import projectoasis.data.CommunityDemand;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.domain.economics.EconomicState;
import projectoasis.domain.energy.DailyEnergyRecord;
import projectoasis.domain.energy.EnergyState;
import projectoasis.domain.farm.CropPlanting;
import projectoasis.domain.farm.FarmState;
import projectoasis.domain.simulation.SimulationResult;
import projectoasis.domain.simulation.SimulationState;
import projectoasis.domain.water.AquiferState;
import projectoasis.domain.water.DailyWaterRecord;
import projectoasis.domain.water.WaterStorageState;
import projectoasis.economics.FinancingCalculator;
import projectoasis.economics.InfrastructureCostEstimator;
import projectoasis.economics.TariffResolver;
import projectoasis.factory.CropPlantingFactory;
import projectoasis.factory.SimulationStateFactory;
import projectoasis.physics.dispatch.MeritOrderEnergyDispatcher;
import projectoasis.physics.i.IEnergyDispatcher;
import projectoasis.physics.i.IGenerationModel;
import projectoasis.physics.model.PumpingEnergyModel;
import projectoasis.physics.model.PvGenerationModel;
import projectoasis.physics.model.WaterStressYieldModel;
import projectoasis.physics.model.WindGenerationModel;
import projectoasis.policy.food.FoodPolicyFactory;
import projectoasis.policy.i.IFoodProcessingPolicy;
import projectoasis.policy.i.IWaterPolicy;
import projectoasis.policy.water.WaterAllocation;
import projectoasis.policy.water.WaterPolicyContext;
import projectoasis.policy.water.WaterPolicyFactory;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orquesta la simulación diaria agua-energía-cultivos de la comunidad.
 * <p>
 * Avanza exactamente un día natural por paso, de {@code startDate} a {@code endDate} inclusive.
 * Cada día: cambio de año si procede, demanda doméstica, asignación de agua por granja,
 * cosechas y un único despacho energético comunitario. El SOC de la batería y la extracción
 * acumulada del acuífero sobreviven a los cambios de año; los acumuladores anuales no.
 * <p>
 * Cualquier error de configuración se lanza en el constructor, antes de simular el primer día.
 */
@Slf4j
public class DailySimulator {

    private final ScenarioConfig config;
    private final ISimulationDataProvider dataProvider;

    private final Map<String, FarmConfig> farmConfigs = new LinkedHashMap<>();
    private final Map<String, IWaterPolicy> waterPolicies = new LinkedHashMap<>();
    private final Map<String, IFoodProcessingPolicy> foodPolicies = new LinkedHashMap<>();

    private final TariffResolver tariffs;
    private final CropPlantingFactory plantingFactory;
    private final WaterPolicyContextAssembler contextAssembler;
    private final HarvestProcessor harvestProcessor;
    private final IEnergyDispatcher dispatcher;

    @Getter
    private final SimulationState state;

    public DailySimulator(ScenarioConfig config, ISimulationDataProvider dataProvider) {
        ScenarioValidator.validate(config);
        this.config = config;
        this.dataProvider = dataProvider;

        // 1. Políticas: un nombre desconocido falla aquí
        WaterPolicyFactory waterPolicyFactory = new WaterPolicyFactory();
        FoodPolicyFactory foodPolicyFactory = new FoodPolicyFactory();
        for (FarmConfig farm : config.getFarms()) {
            farmConfigs.put(farm.getId(), farm);
            waterPolicies.put(farm.getId(), waterPolicyFactory.create(farm.getWaterPolicy()));
            foodPolicies.put(farm.getId(), foodPolicyFactory.create(farm.getFoodPolicy()));
        }

        // 2. Modelos físicos
        InfrastructureConfig infra = config.getInfrastructure();
        IGenerationModel pvModel = new PvGenerationModel(infra.getPv().capacityKw(), infra.getPv().density(),
                config.getPvDegradationRate(), config.getStartDate(), dataProvider);
        IGenerationModel windModel = new WindGenerationModel(infra.getWind().capacityKw(),
                infra.getWind().turbineType(), dataProvider);
        this.tariffs = new TariffResolver(config.getPricing(), config.getStartDate().getYear());
        this.contextAssembler = new WaterPolicyContextAssembler(config,
                new PumpingEnergyModel(infra.getPumpSystem()), pvModel, windModel, tariffs);
        this.harvestProcessor = new HarvestProcessor(dataProvider, new WaterStressYieldModel());
        this.dispatcher = new MeritOrderEnergyDispatcher(pvModel, windModel, dataProvider);

        // 3. Estado inicial
        this.plantingFactory = new CropPlantingFactory(dataProvider);
        SimulationStateFactory stateFactory = new SimulationStateFactory(dataProvider, plantingFactory,
                new SystemConstraintCalculator(),
                new InfrastructureCostEstimator(config.getReferenceCosts(), new FinancingCalculator()));
        this.state = stateFactory.create(config);

        log.info("DailySimulator inicializado. Periodo={}..{}, granjas={}, tratamiento={} kWh/m³, "
                        + "PV={} kW, eólica={} kW, batería={} kWh, generador={} kW, red={}",
                config.getStartDate(), config.getEndDate(), config.getFarms().size(),
                state.getTreatmentKwhPerM3(), infra.getPv().capacityKw(), infra.getWind().capacityKw(),
                infra.getBattery().getCapacityKwh(), infra.getGenerator().getCapacityKw(), infra.isGridConnected());
        state.getCapacityShares().values().forEach(share ->
                log.info("  Granja {}: pozos {} m³/día, tratamiento {} m³/día", share.farmId(),
                        share.wellCapacityM3Day(), share.treatmentCapacityM3Day()));
    }

    /**
     * Ejecuta la simulación completa. Solo puede llamarse una vez por instancia.
     */
    public SimulationResult run() {
        if (state.daysSimulated() > 0) {
            throw new IllegalStateException("La simulación ya se ejecutó; cree un nuevo DailySimulator.");
        }
        LocalDate date = state.getStartDate();
        int currentYear = date.getYear();

        while (!date.isAfter(state.getEndDate())) {
            if (date.getYear() != currentYear) {
                closeYear(currentYear);
                openYear(date.getYear());
                currentYear = date.getYear();
            }
            simulateDay(date);
            date = date.plusDays(1);
            state.setCurrentDate(date);
        }
        closeYear(state.getEndDate().getYear());

        SimulationResult result = buildResult();
        Double yearsRemaining = result.aquifer().yearsRemaining();
        log.info("Simulación completada: {} días, extracción acumulada {} m³, años restantes {}, SOC final {}.",
                result.daysSimulated(), String.format("%.1f", result.aquifer().cumulativeExtractionM3()),
                yearsRemaining == null ? "ilimitados" : String.format("%.1f", yearsRemaining),
                String.format("%.3f", result.finalBatterySoc()));
        return result;
    }

    /**
     * Simula un único día sobre el estado actual.
     */
    public void simulateDay(LocalDate date) {
        AquiferState aquifer = state.getAquifer();
        WaterStorageState storage = state.getStorage();
        EconomicState economics = state.getEconomics();

        // 1. Demanda doméstica comunitaria: agua tratada desde el acuífero y carga eléctrica
        CommunityDemand community = dataProvider.communityDemand(date);
        double communityWaterM3 = community.totalM3();
        double waterEnergyKwh = communityWaterM3 * state.getTreatmentKwhPerM3();
        if (communityWaterM3 > 0) {
            aquifer.recordExtraction(communityWaterM3);
            storage.addInflow(communityWaterM3);
            storage.drawOutflow(communityWaterM3);
        }
        economics.addOperatingCost(communityWaterM3 * tariffs.domesticWaterPrice(date)
                + community.totalKwh() * tariffs.domesticEnergyPrice(date));

        // 2. Riego por granja y cosechas
        for (FarmState farm : state.getFarms()) {
            waterEnergyKwh += irrigate(farm, date);
            harvestProcessor.processHarvests(farm, date, foodPolicies.get(farm.getId()));
        }

        state.getStorageRecords().add(storage.closeDay(date, community.householdM3(), community.buildingM3()));

        // 3. Despacho energético comunitario
        DailyEnergyRecord energy = dispatcher.dispatch(state.getEnergy(), date,
                waterEnergyKwh + community.totalKwh());
        if (energy.dieselCostUsd() > 0) {
            economics.addOperatingCost(energy.dieselCostUsd());
        }
        log.debug("{}: demanda eléctrica {} kWh, SOC {}", date, String.format("%.1f", energy.demandKwh()),
                String.format("%.3f", energy.batterySoc()));
    }

    /**
     * Calcula la demanda de riego de la granja, aplica su política y reparte el agua entregada
     * entre sus siembras activas en proporción a su demanda.
     *
     * @return energía consumida por el agua subterránea de la granja [kWh].
     */
    private double irrigate(FarmState farm, LocalDate date) {
        Map<CropPlanting, Double> demandByPlanting = new LinkedHashMap<>();
        double totalDemand = 0.0;
        for (CropPlanting planting : farm.activePlantings(date)) {
            double demand = dataProvider.irrigationM3PerHa(planting.getCropName(), planting.getPlantingDate(), date)
                    * planting.getAreaHa();
            demandByPlanting.put(planting, demand);
            totalDemand += demand;
        }
        if (totalDemand <= 0) {
            return 0.0;
        }

        WaterPolicyContext context = contextAssembler.assemble(state, farm, date, totalDemand);
        WaterAllocation allocation = waterPolicies.get(farm.getId()).allocate(context);

        farm.recordWaterDelivery(DailyWaterRecord.builder()
                .date(date)
                .farmId(farm.getId())
                .demandM3(totalDemand)
                .groundwaterM3(allocation.groundwaterM3())
                .municipalM3(allocation.municipalM3())
                .costUsd(allocation.costUsd())
                .energyKwh(allocation.energyUsedKwh())
                .energyCostUsd(allocation.energyUsedKwh() * context.energyPricePerKwh())
                .decisionReason(allocation.decision().reason())
                .groundwaterCostPerM3(allocation.decision().groundwaterCostPerM3())
                .municipalCostPerM3(allocation.decision().municipalCostPerM3())
                .constraintHit(allocation.decision().constraintHit())
                .limitingFactor(allocation.decision().limitingFactor())
                .build());

        double deliveryRatio = allocation.totalM3() / totalDemand;
        demandByPlanting.forEach((planting, demand) -> farm.creditPlantingWater(planting, demand * deliveryRatio));

        if (allocation.groundwaterM3() > 0) {
            state.getAquifer().recordExtraction(allocation.groundwaterM3());
            state.getStorage().addInflow(allocation.groundwaterM3());
            state.getStorage().drawOutflow(allocation.groundwaterM3());
        }
        return allocation.energyUsedKwh();
    }

    /** Cierre de año: economía, instantáneas de granjas y de energía. */
    private void closeYear(int year) {
        double revenue = 0.0;
        double waterCost = 0.0;
        double fertilizerCost = 0.0;
        for (FarmState farm : state.getFarms()) {
            revenue += farm.getTotalRevenueUsd();
            waterCost += farm.getWaterCostUsd();
            fertilizerCost += farm.getFertilizerCostUsd();
        }
        state.getEconomics().rollUpYear(revenue, waterCost, fertilizerCost);

        for (FarmState farm : state.getFarms()) {
            state.getYearlyFarmMetrics().add(farm.snapshotYear(year));
        }
        state.getYearlyEnergyMetrics().add(state.getEnergy().snapshotYear(year));

        log.info("Cierre del año {}: ingresos {} USD, coste de agua {} USD, caja {} USD.", year,
                String.format("%.2f", revenue), String.format("%.2f", waterCost),
                String.format("%.2f", state.getEconomics().getCashReservesUsd()));
    }

    /** Apertura de año: reinicio de acumuladores y nuevas siembras. El SOC no se toca. */
    private void openYear(int year) {
        for (FarmState farm : state.getFarms()) {
            farm.resetYearlyAccumulators();
            plantingFactory.plantYear(farm, farmConfigs.get(farm.getId()), year);
        }
        state.getEnergy().resetYearlyAccumulators();
    }

    private SimulationResult buildResult() {
        EconomicState economics = state.getEconomics();
        AquiferState aquifer = state.getAquifer();
        EnergyState energy = state.getEnergy();
        double years = state.yearsElapsed(state.getCurrentDate());
        double yearsRemaining = aquifer.yearsRemaining(years);
        double baseDepth = config.getInfrastructure().getWells().depthM();

        return SimulationResult.builder()
                .startDate(state.getStartDate())
                .endDate(state.getEndDate())
                .daysSimulated(state.daysSimulated())
                .yearlyFarmMetrics(List.copyOf(state.getYearlyFarmMetrics()))
                .yearlyEnergyMetrics(List.copyOf(state.getYearlyEnergyMetrics()))
                .economics(SimulationResult.EconomicSummary.builder()
                        .cashReservesUsd(economics.getCashReservesUsd())
                        .cumulativeRevenueUsd(economics.getCumulativeRevenueUsd())
                        .cumulativeOperatingCostUsd(economics.getCumulativeOperatingCostUsd())
                        .cumulativeDebtServiceUsd(economics.getCumulativeDebtServiceUsd())
                        .cumulativeInfrastructureCostUsd(economics.getCumulativeInfrastructureCostUsd())
                        .annualInfrastructureCostUsd(economics.getAnnualInfrastructureCostUsd())
                        .build())
                .aquifer(SimulationResult.AquiferSummary.builder()
                        .cumulativeExtractionM3(aquifer.getCumulativeExtractionM3())
                        .netDepletionM3(aquifer.netDepletionM3(years))
                        .drawdownM(aquifer.currentDrawdownM())
                        .effectiveHeadM(aquifer.effectiveHeadM(baseDepth))
                        .yearsRemaining(Double.isInfinite(yearsRemaining) ? null : yearsRemaining)
                        .build())
                .finalBatterySoc(energy.getBatterySoc())
                .build();
    }
}
