package projectoasis.policy.water.impl;

import projectoasis.policy.water.AbstractWaterPolicy;
import projectoasis.policy.water.WaterAllocation;
import projectoasis.policy.water.WaterPolicyContext;
import projectoasis.policy.water.WaterPolicyType;

/**
 * Toda la demanda desde la red municipal: sin extracción ni energía de tratamiento.
 */
public class AlwaysMunicipalPolicy extends AbstractWaterPolicy {

    @Override
    public WaterAllocation allocate(WaterPolicyContext ctx) {
        return buildAllocation(ctx, 0.0, groundwaterCostPerM3(ctx), "muni_only", null, null);
    }

    @Override
    public String getName() {
        return WaterPolicyType.ALWAYS_MUNICIPAL.getCode();
    }
}
