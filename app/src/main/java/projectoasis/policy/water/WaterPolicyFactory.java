package projectoasis.policy.water;

import projectoasis.config.WaterPolicyParameters;
import projectoasis.config.WaterPolicySpec;
import projectoasis.exception.ScenarioConfigurationException;
import projectoasis.policy.i.IWaterPolicy;
import projectoasis.policy.water.impl.AlwaysGroundwaterPolicy;
import projectoasis.policy.water.impl.AlwaysMunicipalPolicy;
import projectoasis.policy.water.impl.CheapestSourcePolicy;
import projectoasis.policy.water.impl.ConserveGroundwaterPolicy;
import projectoasis.policy.water.impl.QuotaEnforcedPolicy;

/**
 * Construye políticas de agua a partir de su especificación de configuración.
 * Un nombre desconocido o unos parámetros incoherentes fallan aquí, antes de simular.
 */
public class WaterPolicyFactory {

    public IWaterPolicy create(WaterPolicySpec spec) {
        if (spec == null) {
            throw new ScenarioConfigurationException("Falta la especificación de la política de agua.");
        }
        WaterPolicyParameters params = spec.parameters();
        switch (WaterPolicyType.fromCode(spec.name())) {
            case ALWAYS_GROUNDWATER:
                return new AlwaysGroundwaterPolicy();
            case ALWAYS_MUNICIPAL:
                return new AlwaysMunicipalPolicy();
            case CHEAPEST_SOURCE:
                return new CheapestSourcePolicy(params.isIncludeEnergyCost());
            case CONSERVE_GROUNDWATER:
                if (params.getMaxGroundwaterRatio() < 0 || params.getMaxGroundwaterRatio() > 1) {
                    throw new ScenarioConfigurationException("maxGroundwaterRatio debe estar en [0, 1].");
                }
                return new ConserveGroundwaterPolicy(params.getPriceThresholdMultiplier(),
                        params.getMaxGroundwaterRatio());
            case QUOTA_ENFORCED:
                if (params.getAnnualQuotaM3() == null || params.getAnnualQuotaM3() < 0) {
                    throw new ScenarioConfigurationException("quota_enforced requiere una cuota anual no negativa.");
                }
                return new QuotaEnforcedPolicy(params.getAnnualQuotaM3(), params.getMonthlyVariance());
            default:
                throw new ScenarioConfigurationException("Política de agua no soportada: " + spec.name());
        }
    }
}
