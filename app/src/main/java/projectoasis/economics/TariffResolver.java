package projectoasis.economics;

import projectoasis.config.PricingConfig;

import java.time.LocalDate;

/**
 * Resuelve los precios de agua y electricidad de un día según el régimen tarifario.
 * El escalado anual se cuenta desde el año de inicio de la simulación.
 */
public class TariffResolver {

    private final PricingConfig pricing;
    private final int startYear;

    public TariffResolver(PricingConfig pricing, int startYear) {
        this.pricing = pricing;
        this.startYear = startYear;
    }

    public double agriculturalWaterPrice(LocalDate date) {
        return pricing.getAgriculturalWater().priceFor(date.getYear(), startYear);
    }

    public double domesticWaterPrice(LocalDate date) {
        return pricing.getDomesticWater().priceFor(date.getYear(), startYear);
    }

    public double agriculturalEnergyPrice(LocalDate date) {
        return pricing.getAgriculturalElectricity().priceFor(date.getYear(), startYear);
    }

    public double domesticEnergyPrice(LocalDate date) {
        return pricing.getDomesticElectricity().priceFor(date.getYear(), startYear);
    }
}
