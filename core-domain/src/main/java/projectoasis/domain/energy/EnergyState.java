package projectoasis.domain.energy;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Estado energético comunitario.
 * <p>
 * El estado de carga de la batería persiste durante toda la simulación y siempre queda
 * dentro de [socMin, socMax]. Los acumuladores son anuales y se reinician con
 * {@link #resetYearlyAccumulators()}, que nunca toca el SOC.
 */
@Getter
public class EnergyState {

    private final double pvCapacityKw;
    private final double windCapacityKw;
    private final double batteryCapacityKwh;
    private final double socMin;
    private final double socMax;
    private final double chargeEfficiency;
    private final double dischargeEfficiency;
    private final double generatorCapacityKw;
    private final double fuelCoefficientA;
    private final double fuelCoefficientB;
    private final boolean gridConnected;

    private double batterySoc;

    private final List<DailyEnergyRecord> dailyRecords = new ArrayList<>();

    // --- Acumuladores anuales ---
    private double demandKwh;
    private double pvKwh;
    private double windKwh;
    private double batteryChargeKwh;
    private double batteryDischargeKwh;
    private double gridImportKwh;
    private double gridExportKwh;
    private double generatorKwh;
    private double generatorFuelL;
    private double dieselCostUsd;
    private double curtailedKwh;
    private double unservedKwh;

    @Builder
    private EnergyState(double pvCapacityKw, double windCapacityKw, double batteryCapacityKwh,
                        double initialSoc, double socMin, double socMax,
                        double chargeEfficiency, double dischargeEfficiency,
                        double generatorCapacityKw, double fuelCoefficientA, double fuelCoefficientB,
                        boolean gridConnected) {
        if (socMin > socMax) {
            throw new IllegalArgumentException("socMin no puede superar socMax.");
        }
        this.pvCapacityKw = pvCapacityKw;
        this.windCapacityKw = windCapacityKw;
        this.batteryCapacityKwh = batteryCapacityKwh;
        this.socMin = socMin;
        this.socMax = socMax;
        this.chargeEfficiency = chargeEfficiency;
        this.dischargeEfficiency = dischargeEfficiency;
        this.generatorCapacityKw = generatorCapacityKw;
        this.fuelCoefficientA = fuelCoefficientA;
        this.fuelCoefficientB = fuelCoefficientB;
        this.gridConnected = gridConnected;
        this.batterySoc = clampSoc(initialSoc);
    }

    public boolean hasBattery() {
        return batteryCapacityKwh > 0;
    }

    public boolean hasGenerator() {
        return generatorCapacityKw > 0;
    }

    /** Fija el SOC acotándolo a [socMin, socMax] para absorber la deriva de coma flotante. */
    public void updateSoc(double soc) {
        this.batterySoc = clampSoc(soc);
    }

    private double clampSoc(double soc) {
        return Math.max(socMin, Math.min(socMax, soc));
    }

    public void recordDispatch(DailyEnergyRecord record) {
        demandKwh += record.demandKwh();
        pvKwh += record.pvKwh();
        windKwh += record.windKwh();
        batteryChargeKwh += record.batteryChargeKwh();
        batteryDischargeKwh += record.batteryDischargeKwh();
        gridImportKwh += record.gridImportKwh();
        gridExportKwh += record.gridExportKwh();
        generatorKwh += record.generatorKwh();
        generatorFuelL += record.generatorFuelL();
        dieselCostUsd += record.dieselCostUsd();
        curtailedKwh += record.curtailedKwh();
        unservedKwh += record.unservedKwh();
        dailyRecords.add(record);
    }

    public List<DailyEnergyRecord> getDailyRecords() {
        return Collections.unmodifiableList(dailyRecords);
    }

    public YearlyEnergyMetrics snapshotYear(int year) {
        return YearlyEnergyMetrics.builder()
                .year(year)
                .demandKwh(demandKwh)
                .pvKwh(pvKwh)
                .windKwh(windKwh)
                .batteryChargeKwh(batteryChargeKwh)
                .batteryDischargeKwh(batteryDischargeKwh)
                .gridImportKwh(gridImportKwh)
                .gridExportKwh(gridExportKwh)
                .generatorKwh(generatorKwh)
                .generatorFuelL(generatorFuelL)
                .dieselCostUsd(dieselCostUsd)
                .curtailedKwh(curtailedKwh)
                .unservedKwh(unservedKwh)
                .endOfYearSoc(batterySoc)
                .build();
    }

    public void resetYearlyAccumulators() {
        demandKwh = 0.0;
        pvKwh = 0.0;
        windKwh = 0.0;
        batteryChargeKwh = 0.0;
        batteryDischargeKwh = 0.0;
        gridImportKwh = 0.0;
        gridExportKwh = 0.0;
        generatorKwh = 0.0;
        generatorFuelL = 0.0;
        dieselCostUsd = 0.0;
        curtailedKwh = 0.0;
        unservedKwh = 0.0;
    }
}
