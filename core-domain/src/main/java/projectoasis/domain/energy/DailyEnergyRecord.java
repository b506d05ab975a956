package projectoasis.domain.energy;

import lombok.Builder;

import java.time.LocalDate;

/**
 * Registro inmutable del despacho energético comunitario de un día [kWh salvo indicación].
 *
 * @param batterySoc SOC resultante tras el despacho, dentro de [socMin, socMax].
 */
@Builder
public record DailyEnergyRecord(LocalDate date,
                                double demandKwh,
                                double pvKwh,
                                double windKwh,
                                double batteryChargeKwh,
                                double batteryDischargeKwh,
                                double gridImportKwh,
                                double gridExportKwh,
                                double generatorKwh,
                                double generatorHours,
                                double generatorFuelL,
                                double dieselCostUsd,
                                double curtailedKwh,
                                double unservedKwh,
                                double batterySoc) {

    public double renewableKwh() {
        return pvKwh + windKwh;
    }
}
