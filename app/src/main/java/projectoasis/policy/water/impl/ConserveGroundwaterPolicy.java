package projectoasis.policy.water.impl;

import lombok.Getter;
import projectoasis.policy.water.AbstractWaterPolicy;
import projectoasis.policy.water.WaterAllocation;
import projectoasis.policy.water.WaterPolicyContext;
import projectoasis.policy.water.WaterPolicyType;

/**
 * Prioriza la red municipal y reserva el acuífero.
 * <p>
 * Solo recurre al agua subterránea cuando el precio municipal supera
 * {@code priceThresholdMultiplier} veces el coste subterráneo, y aun así limita
 * su uso a {@code maxGroundwaterRatio} de la demanda.
 */
@Getter
public class ConserveGroundwaterPolicy extends AbstractWaterPolicy {

    private static final String RATIO_CAP = "ratio_cap";

    private final double priceThresholdMultiplier;
    private final double maxGroundwaterRatio;

    public ConserveGroundwaterPolicy(double priceThresholdMultiplier, double maxGroundwaterRatio) {
        this.priceThresholdMultiplier = priceThresholdMultiplier;
        this.maxGroundwaterRatio = maxGroundwaterRatio;
    }

    @Override
    public WaterAllocation allocate(WaterPolicyContext ctx) {
        double gwCost = groundwaterCostPerM3(ctx);

        if (ctx.municipalPricePerM3() > gwCost * priceThresholdMultiplier) {
            ConstrainedVolume constrained = applyConstraints(ctx.demandM3() * maxGroundwaterRatio, ctx);
            String limitingFactor = constrained.constraintHit() != null
                    ? constrained.constraintHit().getCode()
                    : RATIO_CAP;
            return buildAllocation(ctx, constrained.volumeM3(), gwCost,
                    withConstraint("threshold_exceeded", constrained.constraintHit()),
                    constrained.constraintHit(), limitingFactor);
        }
        return buildAllocation(ctx, 0.0, gwCost, "threshold_not_met", null, null);
    }

    @Override
    public String getName() {
        return WaterPolicyType.CONSERVE_GROUNDWATER.getCode();
    }
}
