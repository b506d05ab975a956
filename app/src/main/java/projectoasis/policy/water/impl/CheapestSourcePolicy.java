package projectoasis.policy.water.impl;

import lombok.Getter;
import projectoasis.policy.water.AbstractWaterPolicy;
import projectoasis.policy.water.WaterAllocation;
import projectoasis.policy.water.WaterPolicyContext;
import projectoasis.policy.water.WaterPolicyType;

/**
 * Elige cada día la fuente más barata.
 * <p>
 * Con {@code includeEnergyCost = false} la comparación usa solo el O&amp;M por m³, pero el coste
 * cargado al agua subterránea incluye siempre la energía. La asimetría es intencionada.
 */
@Getter
public class CheapestSourcePolicy extends AbstractWaterPolicy {

    private final boolean includeEnergyCost;

    public CheapestSourcePolicy(boolean includeEnergyCost) {
        this.includeEnergyCost = includeEnergyCost;
    }

    @Override
    public WaterAllocation allocate(WaterPolicyContext ctx) {
        double fullGwCost = groundwaterCostPerM3(ctx);
        double comparedGwCost = includeEnergyCost ? fullGwCost : ctx.groundwaterMaintenancePerM3();

        if (comparedGwCost < ctx.municipalPricePerM3()) {
            ConstrainedVolume constrained = applyConstraints(ctx.demandM3(), ctx);
            return buildAllocation(ctx, constrained.volumeM3(), fullGwCost,
                    withConstraint("gw_cheaper", constrained.constraintHit()),
                    constrained.constraintHit(), codeOf(constrained.constraintHit()));
        }
        return buildAllocation(ctx, 0.0, fullGwCost, "muni_cheaper", null, null);
    }

    @Override
    public String getName() {
        return WaterPolicyType.CHEAPEST_SOURCE.getCode();
    }
}
