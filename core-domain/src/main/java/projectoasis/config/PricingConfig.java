package projectoasis.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Tarifas de agua y electricidad, separadas para uso agrícola y doméstico.
 * Diésel, fertilizante y precios de cultivo llegan por fecha desde el proveedor de datos.
 */
@Value
@Builder
@With
public class PricingConfig {
    WaterTariff agriculturalWater;
    WaterTariff domesticWater;
    ElectricityTariff agriculturalElectricity;
    ElectricityTariff domesticElectricity;
}
