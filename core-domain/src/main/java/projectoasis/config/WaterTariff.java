package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Tarifa de agua municipal.
 *
 * @param regime              Régimen tarifario.
 * @param subsidizedPricePerM3 Precio plano subvencionado [USD/m³].
 * @param basePricePerM3      Precio de mercado del año de inicio [USD/m³].
 * @param annualEscalationPct Escalado anual del precio de mercado [%].
 */
@Builder
@With
public record WaterTariff(PricingRegime regime,
                          double subsidizedPricePerM3,
                          double basePricePerM3,
                          double annualEscalationPct) {

    public double priceFor(int year, int startYear) {
        if (regime == PricingRegime.SUBSIDIZED) {
            return subsidizedPricePerM3;
        }
        return basePricePerM3 * Math.pow(1.0 + annualEscalationPct / 100.0, year - startYear);
    }

    public static WaterTariff flat(double pricePerM3) {
        return new WaterTariff(PricingRegime.SUBSIDIZED, pricePerM3, pricePerM3, 0.0);
    }
}
