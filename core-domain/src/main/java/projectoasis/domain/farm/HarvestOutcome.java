package projectoasis.domain.farm;

import lombok.Builder;

/**
 * Resultado inmutable de cosechar una siembra.
 *
 * @param yieldKg             Cosecha tras el estrés hídrico [kg].
 * @param waterRatio          ETa/ETc aproximado como agua recibida / agua esperada, acotado a 1.
 * @param stressFactor        Factor de estrés hídrico en [0, 1].
 * @param freshPricePerKg     Precio en fresco del día de cosecha [USD/kg].
 * @param freshRevenueUsd     Ingreso de la fracción vendida en fresco.
 * @param processedRevenueUsd Ingreso de las fracciones procesadas.
 * @param processedOutputKg   Masa procesada tras la pérdida de peso [kg].
 * @param postHarvestLossKg   Masa perdida entre la cosecha y la venta [kg].
 * @param split               Reparto aplicado por la política de procesado.
 */
@Builder
public record HarvestOutcome(double yieldKg,
                             double waterRatio,
                             double stressFactor,
                             double freshPricePerKg,
                             double freshRevenueUsd,
                             double processedRevenueUsd,
                             double processedOutputKg,
                             double postHarvestLossKg,
                             ProcessingSplit split) {

    public double totalRevenueUsd() {
        return freshRevenueUsd + processedRevenueUsd;
    }
}
