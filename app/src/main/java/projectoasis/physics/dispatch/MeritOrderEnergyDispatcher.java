package projectoasis.physics.dispatch;

import lombok.extern.slf4j.Slf4j;
import projectoasis.data.ISimulationDataProvider;
import projectoasis.domain.energy.DailyEnergyRecord;
import projectoasis.domain.energy.EnergyState;
import projectoasis.physics.i.IEnergyDispatcher;
import projectoasis.physics.i.IGenerationModel;
import projectoasis.physics.model.GeneratorFuelModel;
import projectoasis.physics.model.GeneratorFuelModel.GeneratorRun;

import java.time.LocalDate;

/**
 * Despacho por orden de mérito, determinista y sin optimización.
 * <p>
 * Excedente: batería, exportación a red, vertido. Déficit: batería, importación de red,
 * generador a plena carga y, si aún falta, energía no servida. Sin conexión a red se
 * omiten importación y exportación.
 */
@Slf4j
public class MeritOrderEnergyDispatcher implements IEnergyDispatcher {

    private final IGenerationModel pvModel;
    private final IGenerationModel windModel;
    private final ISimulationDataProvider dataProvider;

    public MeritOrderEnergyDispatcher(IGenerationModel pvModel, IGenerationModel windModel,
                                      ISimulationDataProvider dataProvider) {
        this.pvModel = pvModel;
        this.windModel = windModel;
        this.dataProvider = dataProvider;
    }

    @Override
    public DailyEnergyRecord dispatch(EnergyState state, LocalDate date, double demandKwh) {
        double pv = state.getPvCapacityKw() > 0 ? pvModel.dailyKwh(date) : 0.0;
        double wind = state.getWindCapacityKw() > 0 ? windModel.dailyKwh(date) : 0.0;
        return balance(state, date, demandKwh, pv, wind);
    }

    /**
     * Reparte la demanda del día con una generación renovable ya conocida.
     * Actualiza el SOC, los acumuladores anuales y el histórico diario del estado.
     */
    public DailyEnergyRecord balance(EnergyState state, LocalDate date, double demandKwh,
                                     double pvKwh, double windKwh) {
        double net = pvKwh + windKwh - demandKwh;

        double charge = 0.0;
        double discharge = 0.0;
        double gridImport = 0.0;
        double gridExport = 0.0;
        double curtailed = 0.0;
        double unserved = 0.0;
        GeneratorRun generatorRun = GeneratorRun.IDLE;

        if (net >= 0) {
            double surplus = net;
            if (state.hasBattery()) {
                double room = Math.max(0.0, (state.getSocMax() - state.getBatterySoc())
                        * state.getBatteryCapacityKwh() / state.getChargeEfficiency());
                charge = Math.min(surplus, room);
                surplus -= charge;
            }
            if (state.isGridConnected()) {
                gridExport = surplus;
                surplus = 0.0;
            }
            curtailed = surplus;
        } else {
            double deficit = -net;
            if (state.hasBattery()) {
                double available = Math.max(0.0, (state.getBatterySoc() - state.getSocMin())
                        * state.getBatteryCapacityKwh() * state.getDischargeEfficiency());
                discharge = Math.min(deficit, available);
                deficit -= discharge;
            }
            if (state.isGridConnected()) {
                gridImport = deficit;
                deficit = 0.0;
            }
            if (deficit > 0 && state.hasGenerator()) {
                GeneratorFuelModel generator = new GeneratorFuelModel(state.getGeneratorCapacityKw(),
                        state.getFuelCoefficientA(), state.getFuelCoefficientB());
                generatorRun = generator.cover(deficit);
                deficit -= generatorRun.energyKwh();
            }
            unserved = Math.max(0.0, deficit);
        }

        if (state.hasBattery()) {
            double socDelta = (charge * state.getChargeEfficiency() - discharge / state.getDischargeEfficiency())
                    / state.getBatteryCapacityKwh();
            state.updateSoc(state.getBatterySoc() + socDelta);
        }

        double dieselCost = generatorRun.fuelLiters() > 0
                ? generatorRun.fuelLiters() * dataProvider.dieselPricePerLiter(date)
                : 0.0;

        DailyEnergyRecord record = DailyEnergyRecord.builder()
                .date(date)
                .demandKwh(demandKwh)
                .pvKwh(pvKwh)
                .windKwh(windKwh)
                .batteryChargeKwh(charge)
                .batteryDischargeKwh(discharge)
                .gridImportKwh(gridImport)
                .gridExportKwh(gridExport)
                .generatorKwh(generatorRun.energyKwh())
                .generatorHours(generatorRun.hours())
                .generatorFuelL(generatorRun.fuelLiters())
                .dieselCostUsd(dieselCost)
                .curtailedKwh(curtailed)
                .unservedKwh(unserved)
                .batterySoc(state.getBatterySoc())
                .build();
        state.recordDispatch(record);

        if (unserved > 0) {
            log.debug("{}: {} kWh sin servir (sin red ni generador suficiente).", date, unserved);
        }
        return record;
    }
}
