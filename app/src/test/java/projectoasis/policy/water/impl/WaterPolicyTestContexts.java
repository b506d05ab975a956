package projectoasis.policy.water.impl;

import projectoasis.policy.water.WaterPolicyContext;

import java.time.LocalDate;

/**
 * Contexto base para las pruebas de políticas de agua.
 * <p>
 * Energía total 2.0 kWh/m³ a 0.10 USD/kWh más 0.05 USD/m³ de O&amp;M:
 * el agua subterránea cuesta 0.25 USD/m³ frente a 0.50 USD/m³ de la red municipal.
 */
final class WaterPolicyTestContexts {

    static final double GW_COST = 0.25;

    private WaterPolicyTestContexts() {
    }

    static WaterPolicyContext base() {
        return WaterPolicyContext.builder()
                .date(LocalDate.of(2025, 6, 15))
                .demandM3(100.0)
                .treatmentKwhPerM3(1.0)
                .pumpingKwhPerM3(0.5)
                .conveyanceKwhPerM3(0.5)
                .groundwaterMaintenancePerM3(0.05)
                .municipalPricePerM3(0.50)
                .energyPricePerKwh(0.10)
                .availableEnergyKwh(Double.POSITIVE_INFINITY)
                .wellCapacityM3Day(1000.0)
                .treatmentCapacityM3Day(1000.0)
                .groundwaterUsedThisMonthM3(0.0)
                .groundwaterUsedThisYearM3(0.0)
                .build();
    }
}
