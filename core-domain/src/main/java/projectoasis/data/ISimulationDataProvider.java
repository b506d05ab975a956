package projectoasis.data;

import projectoasis.config.PvDensity;
import projectoasis.domain.farm.ProcessingPathway;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Contrato del colaborador que aporta las tablas precalculadas de la simulación.
 * <p>
 * Todas las consultas son en memoria. Salvo las que devuelven {@link Optional}, una consulta
 * sin datos lanza {@link projectoasis.exception.MissingDataException}.
 */
public interface ISimulationDataProvider {

    /** Riego diario necesario [m³/ha] de un cultivo sembrado en {@code plantingDate}, el día {@code date}. */
    double irrigationM3PerHa(String cropName, LocalDate plantingDate, LocalDate date);

    /** Vacío si el cultivo no puede sembrarse en esa fecha dentro del escenario. */
    Optional<YieldInfo> yieldInfo(String cropName, LocalDate plantingDate);

    /** Coeficiente Ky de respuesta del rendimiento al déficit hídrico. */
    double yieldResponseFactor(String cropName);

    double weightLossFraction(String cropName, ProcessingPathway pathway);

    double postHarvestLossFraction(String cropName, ProcessingPathway pathway);

    double valueMultiplier(String cropName, ProcessingPathway pathway);

    double pvKwhPerKw(LocalDate date, PvDensity density);

    double windKwhPerKw(LocalDate date, String turbineType);

    CommunityDemand communityDemand(LocalDate date);

    double treatmentKwhPerM3(String salinityLevel);

    double cropPricePerKg(String cropName, LocalDate date);

    double dieselPricePerLiter(LocalDate date);

    double fertilizerCostPerHa(LocalDate date);

    /**
     * Precio de referencia histórico de un cultivo. Por defecto no hay ninguno y las políticas
     * de procesado recurren a sus valores configurados.
     */
    default Optional<Double> referenceCropPrice(String cropName) {
        return Optional.empty();
    }
}
