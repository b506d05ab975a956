package projectoasis.policy.water.impl;

import projectoasis.policy.water.AbstractWaterPolicy;
import projectoasis.policy.water.WaterAllocation;
import projectoasis.policy.water.WaterPolicyContext;
import projectoasis.policy.water.WaterPolicyType;

/**
 * Pide toda la demanda como agua subterránea; lo que recortan los límites físicos
 * se cubre con la red municipal.
 */
public class AlwaysGroundwaterPolicy extends AbstractWaterPolicy {

    @Override
    public WaterAllocation allocate(WaterPolicyContext ctx) {
        double gwCost = groundwaterCostPerM3(ctx);
        ConstrainedVolume constrained = applyConstraints(ctx.demandM3(), ctx);

        String reason;
        if (constrained.constraintHit() != null) {
            reason = withConstraint("gw_preferred", constrained.constraintHit());
        } else if (constrained.volumeM3() < ctx.demandM3()) {
            reason = "gw_preferred_partial";
        } else {
            reason = "gw_preferred";
        }
        return buildAllocation(ctx, constrained.volumeM3(), gwCost, reason,
                constrained.constraintHit(), codeOf(constrained.constraintHit()));
    }

    @Override
    public String getName() {
        return WaterPolicyType.ALWAYS_GROUNDWATER.getCode();
    }
}
