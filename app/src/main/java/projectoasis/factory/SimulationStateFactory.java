package projectoasis.factory;

import lombok.extern.slf4j.Slf4j;
import projectoasis.config.BatteryConfig;
import projectoasis.config.FarmConfig;
import projectoasis.config.GeneratorConfig;
import projectoasis.config.InfrastructureConfig;
import projectoasis.config.ScenarioConfig;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.domain.economics.EconomicState;
import projectoasis.domain.economics.SubsystemCost;
import projectoasis.domain.energy.EnergyState;
import projectoasis.domain.farm.FarmState;
import projectoasis.domain.simulation.SimulationState;
import projectoasis.domain.water.AquiferState;
import projectoasis.domain.water.FarmCapacityShare;
import projectoasis.domain.water.WaterStorageState;
import projectoasis.economics.InfrastructureCostEstimator;
import projectoasis.physics.simulator.SystemConstraintCalculator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Construye el estado inicial de una ejecución a partir del escenario.
 * <p>
 * Cada llamada devuelve objetos nuevos: dos ejecuciones nunca comparten estado mutable.
 */
@Slf4j
public class SimulationStateFactory {

    /** Nivel inicial del depósito como fracción de su capacidad. */
    public static final double INITIAL_STORAGE_FRACTION = 0.5;

    private final ISimulationDataProvider dataProvider;
    private final CropPlantingFactory plantingFactory;
    private final SystemConstraintCalculator constraintCalculator;
    private final InfrastructureCostEstimator costEstimator;

    public SimulationStateFactory(ISimulationDataProvider dataProvider, CropPlantingFactory plantingFactory,
                                  SystemConstraintCalculator constraintCalculator,
                                  InfrastructureCostEstimator costEstimator) {
        this.dataProvider = dataProvider;
        this.plantingFactory = plantingFactory;
        this.constraintCalculator = constraintCalculator;
        this.costEstimator = costEstimator;
    }

    public SimulationState create(ScenarioConfig config) {
        InfrastructureConfig infra = config.getInfrastructure();
        int startYear = config.getStartDate().getYear();

        List<FarmState> farms = new ArrayList<>();
        for (FarmConfig farmConfig : config.getFarms()) {
            FarmState farm = new FarmState(farmConfig.getId(), farmConfig.getName(), farmConfig.getAreaHa(),
                    farmConfig.getWaterPolicy().name());
            plantingFactory.plantYear(farm, farmConfig, startYear);
            farms.add(farm);
        }

        Map<String, FarmCapacityShare> shares = constraintCalculator.calculate(config.getFarms(), infra);

        AquiferState aquifer = new AquiferState(config.getAquifer().exploitableVolumeM3(),
                config.getAquifer().rechargeRateM3Yr(), config.getAquifer().maxDrawdownM());

        double storageCapacity = infra.getStorage().capacityM3();
        WaterStorageState storage = new WaterStorageState(storageCapacity, storageCapacity * INITIAL_STORAGE_FRACTION);

        double totalArea = config.getFarms().stream().mapToDouble(FarmConfig::getAreaHa).sum();
        List<SubsystemCost> subsystemCosts = costEstimator.estimate(infra, totalArea);
        double initialCash = config.getFarms().stream().mapToDouble(FarmConfig::getStartingCapitalUsd).sum();
        EconomicState economics = new EconomicState(initialCash, subsystemCosts);

        double treatmentKwhPerM3 = dataProvider.treatmentKwhPerM3(infra.getTreatment().salinityLevel());

        log.info("Estado inicial creado: {} granjas, {} siembras, caja inicial {} USD.", farms.size(),
                farms.stream().mapToInt(f -> f.getPlantings().size()).sum(), initialCash);

        return new SimulationState(config.getStartDate(), config.getEndDate(), farms, shares, aquifer,
                storage, createEnergyState(infra), economics, treatmentKwhPerM3);
    }

    public EnergyState createEnergyState(InfrastructureConfig infra) {
        BatteryConfig battery = infra.getBattery();
        GeneratorConfig generator = infra.getGenerator();
        return EnergyState.builder()
                .pvCapacityKw(infra.getPv().capacityKw())
                .windCapacityKw(infra.getWind().capacityKw())
                .batteryCapacityKwh(battery.getCapacityKwh())
                .initialSoc(battery.getInitialSoc())
                .socMin(battery.getSocMin())
                .socMax(battery.getSocMax())
                .chargeEfficiency(battery.getChargeEfficiency())
                .dischargeEfficiency(battery.getDischargeEfficiency())
                .generatorCapacityKw(generator.getCapacityKw())
                .fuelCoefficientA(generator.getFuelCoefficientA())
                .fuelCoefficientB(generator.getFuelCoefficientB())
                .gridConnected(infra.isGridConnected())
                .build();
    }
}
