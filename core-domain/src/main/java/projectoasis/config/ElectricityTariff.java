package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Tarifa eléctrica de la red.
 */
@Builder
@With
public record ElectricityTariff(PricingRegime regime,
                                double subsidizedPricePerKwh,
                                double unsubsidizedPricePerKwh,
                                double annualEscalationPct) {

    public double priceFor(int year, int startYear) {
        if (regime == PricingRegime.SUBSIDIZED) {
            return subsidizedPricePerKwh;
        }
        return unsubsidizedPricePerKwh * Math.pow(1.0 + annualEscalationPct / 100.0, year - startYear);
    }

    public static ElectricityTariff flat(double pricePerKwh) {
        return new ElectricityTariff(PricingRegime.SUBSIDIZED, pricePerKwh, pricePerKwh, 0.0);
    }
}
