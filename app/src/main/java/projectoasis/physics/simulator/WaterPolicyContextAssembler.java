package projectoasis.physics.simulator;

import projectoasis.config.ScenarioConfig;
import projectoasis.config.WellConfig;
import projectoasis.domain.farm.FarmState;
import projectoasis.domain.simulation.SimulationState;
import projectoasis.domain.water.FarmCapacityShare;
import projectoasis.economics.TariffResolver;
import projectoasis.physics.i.IGenerationModel;
import projectoasis.physics.model.PumpingEnergyModel;
import projectoasis.policy.water.WaterPolicyContext;

import java.time.LocalDate;

/**
 * Monta el contexto diario de una granja para su política de agua.
 * <p>
 * La energía de bombeo se recalcula cada día desde la altura efectiva actual del acuífero.
 * Con renovables instaladas, la energía disponible es la producción renovable del día;
 * sin ellas se asume red ilimitada.
 */
public class WaterPolicyContextAssembler {

    private final ScenarioConfig config;
    private final PumpingEnergyModel pumpingModel;
    private final IGenerationModel pvModel;
    private final IGenerationModel windModel;
    private final TariffResolver tariffs;

    public WaterPolicyContextAssembler(ScenarioConfig config, PumpingEnergyModel pumpingModel,
                                       IGenerationModel pvModel, IGenerationModel windModel,
                                       TariffResolver tariffs) {
        this.config = config;
        this.pumpingModel = pumpingModel;
        this.pvModel = pvModel;
        this.windModel = windModel;
        this.tariffs = tariffs;
    }

    public WaterPolicyContext assemble(SimulationState state, FarmState farm, LocalDate date, double demandM3) {
        WellConfig wells = config.getInfrastructure().getWells();
        FarmCapacityShare share = state.capacityShareOf(farm.getId());

        double effectiveHead = state.getAquifer().effectiveHeadM(wells.depthM());
        double pumpingKwhPerM3 = pumpingModel.pumpingEnergyKwhPerM3(effectiveHead, wells.flowRateM3Day());

        return WaterPolicyContext.builder()
                .date(date)
                .demandM3(demandM3)
                .treatmentKwhPerM3(state.getTreatmentKwhPerM3())
                .pumpingKwhPerM3(pumpingKwhPerM3)
                .conveyanceKwhPerM3(config.getConveyanceKwhPerM3())
                .groundwaterMaintenancePerM3(config.getGroundwaterMaintenancePerM3())
                .municipalPricePerM3(tariffs.agriculturalWaterPrice(date))
                .energyPricePerKwh(tariffs.agriculturalEnergyPrice(date))
                .availableEnergyKwh(availableEnergy(date))
                .wellCapacityM3Day(share.wellCapacityM3Day())
                .treatmentCapacityM3Day(share.treatmentCapacityM3Day())
                .groundwaterUsedThisMonthM3(farm.groundwaterThisMonth(date))
                .groundwaterUsedThisYearM3(farm.getGroundwaterM3())
                .build();
    }

    private double availableEnergy(LocalDate date) {
        if (pvModel.getCapacityKw() <= 0 && windModel.getCapacityKw() <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return pvModel.dailyKwh(date) + windModel.dailyKwh(date);
    }
}
