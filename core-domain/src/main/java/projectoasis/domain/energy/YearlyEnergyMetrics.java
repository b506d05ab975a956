package projectoasis.domain.energy;

import lombok.Builder;

/**
 * Totales energéticos de un año, capturados antes de reiniciar los acumuladores.
 */
@Builder
public record YearlyEnergyMetrics(int year,
                                  double demandKwh,
                                  double pvKwh,
                                  double windKwh,
                                  double batteryChargeKwh,
                                  double batteryDischargeKwh,
                                  double gridImportKwh,
                                  double gridExportKwh,
                                  double generatorKwh,
                                  double generatorFuelL,
                                  double dieselCostUsd,
                                  double curtailedKwh,
                                  double unservedKwh,
                                  double endOfYearSoc) {

    /** Fracción de la demanda cubierta con renovables (directas o vía batería). */
    public double selfSufficiency() {
        if (demandKwh <= 0) {
            return 1.0;
        }
        double fromGridOrGenerator = gridImportKwh + generatorKwh + unservedKwh;
        return Math.max(0.0, 1.0 - fromGridOrGenerator / demandKwh);
    }
}
