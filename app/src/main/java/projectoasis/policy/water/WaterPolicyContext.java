package projectoasis.policy.water;

import lombok.Builder;
import lombok.With;

import java.time.LocalDate;

/**
 * Contexto inmutable de una decisión de asignación de agua.
 *
 * @param date                        Día simulado.
 * @param demandM3                    Demanda de riego del día [m³].
 * @param treatmentKwhPerM3           Energía específica de desalinización [kWh/m³].
 * @param pumpingKwhPerM3             Energía de bombeo a la altura efectiva del día [kWh/m³].
 * @param conveyanceKwhPerM3          Energía de conducción a parcela [kWh/m³].
 * @param groundwaterMaintenancePerM3 O&amp;M fijo por m³ extraído [USD/m³].
 * @param municipalPricePerM3         Precio municipal agrícola del día [USD/m³].
 * @param energyPricePerKwh           Precio eléctrico agrícola del día [USD/kWh].
 * @param availableEnergyKwh          Energía disponible para tratar agua; {@code +∞} si se tira de red.
 * @param wellCapacityM3Day           Parte de la capacidad de pozos de la granja [m³/día].
 * @param treatmentCapacityM3Day      Parte de la capacidad de tratamiento de la granja [m³/día].
 * @param groundwaterUsedThisMonthM3  Agua subterránea ya usada en el mes natural [m³].
 * @param groundwaterUsedThisYearM3   Agua subterránea ya usada en el año [m³].
 */
@Builder
@With
public record WaterPolicyContext(LocalDate date,
                                 double demandM3,
                                 double treatmentKwhPerM3,
                                 double pumpingKwhPerM3,
                                 double conveyanceKwhPerM3,
                                 double groundwaterMaintenancePerM3,
                                 double municipalPricePerM3,
                                 double energyPricePerKwh,
                                 double availableEnergyKwh,
                                 double wellCapacityM3Day,
                                 double treatmentCapacityM3Day,
                                 double groundwaterUsedThisMonthM3,
                                 double groundwaterUsedThisYearM3) {

    public WaterPolicyContext {
        if (demandM3 < 0) {
            throw new IllegalArgumentException("La demanda no puede ser negativa: " + demandM3);
        }
    }

    public double totalEnergyPerM3() {
        return pumpingKwhPerM3 + conveyanceKwhPerM3 + treatmentKwhPerM3;
    }
}
