package projectoasis.policy.water.impl;

import lombok.Getter;
import projectoasis.policy.water.AbstractWaterPolicy;
import projectoasis.policy.water.WaterAllocation;
import projectoasis.policy.water.WaterPolicyContext;
import projectoasis.policy.water.WaterPolicyType;

/**
 * Cuota administrativa de extracción.
 * <p>
 * Límite anual duro más una asignación mensual de {@code cuota/12 · (1 + variance)}.
 * Agotado cualquiera de los dos, el resto del periodo se sirve al 100% desde la red municipal.
 * Con cuota disponible se pide {@code min(demanda, remanente anual, remanente mensual)},
 * sujeto a los límites físicos.
 */
@Getter
public class QuotaEnforcedPolicy extends AbstractWaterPolicy {

    private final double annualQuotaM3;
    private final double monthlyVariance;

    public QuotaEnforcedPolicy(double annualQuotaM3, double monthlyVariance) {
        this.annualQuotaM3 = annualQuotaM3;
        this.monthlyVariance = monthlyVariance;
    }

    public double monthlyMaxM3() {
        return annualQuotaM3 / 12.0 * (1.0 + monthlyVariance);
    }

    @Override
    public WaterAllocation allocate(WaterPolicyContext ctx) {
        double gwCost = groundwaterCostPerM3(ctx);
        double remainingAnnual = Math.max(0.0, annualQuotaM3 - ctx.groundwaterUsedThisYearM3());
        double remainingMonthly = Math.max(0.0, monthlyMaxM3() - ctx.groundwaterUsedThisMonthM3());

        if (remainingAnnual <= 0) {
            return buildAllocation(ctx, 0.0, gwCost, "quota_exhausted", null, "annual_quota");
        }
        if (remainingMonthly <= 0) {
            return buildAllocation(ctx, 0.0, gwCost, "quota_monthly_limit", null, "monthly_quota");
        }

        double quotaRoom = Math.min(remainingAnnual, remainingMonthly);
        double requested = Math.min(ctx.demandM3(), quotaRoom);
        ConstrainedVolume constrained = applyConstraints(requested, ctx);

        if (constrained.constraintHit() != null) {
            return buildAllocation(ctx, constrained.volumeM3(), gwCost,
                    withConstraint("quota_available", constrained.constraintHit()),
                    constrained.constraintHit(), constrained.constraintHit().getCode());
        }
        if (constrained.volumeM3() < ctx.demandM3()) {
            String quotaFactor = remainingAnnual <= remainingMonthly ? "annual_quota" : "monthly_quota";
            return buildAllocation(ctx, constrained.volumeM3(), gwCost, "quota_available_partial",
                    null, quotaFactor);
        }
        return buildAllocation(ctx, constrained.volumeM3(), gwCost, "quota_available", null, null);
    }

    @Override
    public String getName() {
        return WaterPolicyType.QUOTA_ENFORCED.getCode();
    }
}
