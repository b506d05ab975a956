package projectoasis.config;

import projectoasis.exception.ScenarioConfigurationException;

import java.util.HashSet;
import java.util.Set;

/**
 * Validación fail-fast de un {@link ScenarioConfig} antes de simular ningún día.
 * Los nombres de política se validan al construirlas, en sus factorías.
 */
public final class ScenarioValidator {

    private ScenarioValidator() {
    }

    public static void validate(ScenarioConfig config) {
        if (config == null) {
            throw new ScenarioConfigurationException("El escenario no puede ser nulo.");
        }
        require(config.getStartDate() != null, "Falta la fecha de inicio.");
        require(config.getEndDate() != null, "Falta la fecha de fin.");
        require(!config.getEndDate().isBefore(config.getStartDate()),
                "La fecha de fin es anterior a la de inicio.");
        require(config.getInfrastructure() != null, "Falta la configuración de infraestructura.");
        require(config.getPricing() != null, "Falta la configuración de precios.");
        require(config.getAquifer() != null, "Falta la configuración del acuífero.");
        require(config.getFarms() != null && !config.getFarms().isEmpty(), "El escenario no tiene granjas.");
        require(config.getGroundwaterMaintenancePerM3() >= 0, "El mantenimiento por m³ no puede ser negativo.");
        require(config.getConveyanceKwhPerM3() >= 0, "La energía de conducción no puede ser negativa.");

        validateInfrastructure(config.getInfrastructure());
        validatePricing(config.getPricing());

        Set<String> ids = new HashSet<>();
        for (FarmConfig farm : config.getFarms()) {
            validateFarm(farm);
            require(ids.add(farm.getId()), "Identificador de granja duplicado: " + farm.getId());
        }
    }

    private static void validateInfrastructure(InfrastructureConfig infra) {
        require(infra.getWells() != null, "Falta la configuración de pozos.");
        require(infra.getTreatment() != null, "Falta la configuración de tratamiento.");
        require(infra.getStorage() != null, "Falta la configuración del depósito.");
        require(infra.getPv() != null && infra.getWind() != null, "Faltan las plantas renovables.");
        require(infra.getBattery() != null && infra.getGenerator() != null,
                "Faltan la batería o el generador.");
        require(infra.getWells().count() >= 0 && infra.getWells().flowRateM3Day() >= 0,
                "Los pozos no admiten valores negativos.");
        require(infra.getTreatment().capacityM3Day() >= 0, "Capacidad de tratamiento negativa.");
        require(infra.getPv().capacityKw() >= 0 && infra.getWind().capacityKw() >= 0,
                "Potencia renovable negativa.");
        require(infra.getPv().capacityKw() == 0 || infra.getPv().density() != null,
                "La planta PV necesita una densidad de instalación.");

        BatteryConfig battery = infra.getBattery();
        require(battery.getCapacityKwh() >= 0, "Capacidad de batería negativa.");
        require(battery.getSocMin() >= 0 && battery.getSocMin() < battery.getSocMax() && battery.getSocMax() <= 1.0,
                "Límites de SOC inválidos: se requiere 0 <= socMin < socMax <= 1.");
        require(battery.getInitialSoc() >= battery.getSocMin() && battery.getInitialSoc() <= battery.getSocMax(),
                "El SOC inicial debe estar dentro de [socMin, socMax].");
        require(inUnitInterval(battery.getChargeEfficiency()) && inUnitInterval(battery.getDischargeEfficiency()),
                "Las eficiencias de la batería deben estar en (0, 1].");

        require(infra.getGenerator().getCapacityKw() >= 0, "Potencia de generador negativa.");
        require(inUnitInterval(infra.getPumpSystem().getPumpEfficiency()), "Eficiencia de bomba fuera de (0, 1].");
        require(infra.getPumpSystem().getPipeDiameterM() > 0, "El diámetro de tubería debe ser positivo.");
    }

    private static void validatePricing(PricingConfig pricing) {
        require(pricing.getAgriculturalWater() != null && pricing.getDomesticWater() != null,
                "Faltan las tarifas de agua.");
        require(pricing.getAgriculturalElectricity() != null && pricing.getDomesticElectricity() != null,
                "Faltan las tarifas eléctricas.");
    }

    private static void validateFarm(FarmConfig farm) {
        require(farm.getId() != null && !farm.getId().isBlank(), "Granja sin identificador.");
        require(farm.getAreaHa() > 0, "La superficie de la granja " + farm.getId() + " debe ser positiva.");
        require(farm.getWaterPolicy() != null && farm.getWaterPolicy().name() != null,
                "La granja " + farm.getId() + " no tiene política de agua.");
        double totalFraction = 0.0;
        for (CropScheduleEntry crop : farm.getCrops()) {
            require(crop.areaFraction() >= 0 && crop.percentPlanted() >= 0,
                    "Fracciones negativas en el cultivo " + crop.cropName());
            totalFraction += crop.areaFraction();
        }
        require(totalFraction <= 1.0 + 1e-9,
                "Las fracciones de superficie de la granja " + farm.getId() + " superan 1.0.");
    }

    private static boolean inUnitInterval(double value) {
        return value > 0 && value <= 1.0;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ScenarioConfigurationException(message);
        }
    }
}
