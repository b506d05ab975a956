package projectoasis.policy.water;

import projectoasis.domain.water.ConstraintType;
import projectoasis.policy.i.IWaterPolicy;

/**
 * Cálculos comunes a todas las políticas de agua: coste unitario subterráneo,
 * volumen limitado por energía y recorte por límites físicos.
 */
public abstract class AbstractWaterPolicy implements IWaterPolicy {

    /** Volumen subterráneo tras aplicar los límites físicos y el límite que lo recortó. */
    protected record ConstrainedVolume(double volumeM3, ConstraintType constraintHit) {
    }

    /** {@code (bombeo + conducción + tratamiento) · precio energía + O&M por m³}. */
    protected double groundwaterCostPerM3(WaterPolicyContext ctx) {
        return ctx.totalEnergyPerM3() * ctx.energyPricePerKwh() + ctx.groundwaterMaintenancePerM3();
    }

    /**
     * Volumen tratable con la energía disponible. Una energía específica nula o negativa
     * se trata como volumen ilimitado.
     */
    protected double maxEnergyLimitedM3(WaterPolicyContext ctx) {
        double energyPerM3 = ctx.totalEnergyPerM3();
        if (energyPerM3 <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return ctx.availableEnergyKwh() / energyPerM3;
    }

    /**
     * Recorta la petición al mínimo de energía, pozos y tratamiento.
     * En caso de empate prevalece el límite evaluado primero. Solo se informa el límite
     * si el resultado queda por debajo de lo pedido.
     */
    protected ConstrainedVolume applyConstraints(double requestedM3, WaterPolicyContext ctx) {
        double volume = requestedM3;
        ConstraintType hit = null;

        double energyLimit = maxEnergyLimitedM3(ctx);
        if (energyLimit < volume) {
            volume = energyLimit;
            hit = ConstraintType.ENERGY_LIMIT;
        }
        if (ctx.wellCapacityM3Day() < volume) {
            volume = ctx.wellCapacityM3Day();
            hit = ConstraintType.WELL_LIMIT;
        }
        if (ctx.treatmentCapacityM3Day() < volume) {
            volume = ctx.treatmentCapacityM3Day();
            hit = ConstraintType.TREATMENT_LIMIT;
        }

        volume = Math.max(0.0, volume);
        return new ConstrainedVolume(volume, volume < requestedM3 ? hit : null);
    }

    /**
     * Construye la asignación: lo que no cubre el agua subterránea lo cubre la red municipal.
     */
    protected WaterAllocation buildAllocation(WaterPolicyContext ctx, double groundwaterM3,
                                              double chargedGroundwaterCostPerM3, String reason,
                                              ConstraintType constraintHit, String limitingFactor) {
        double gw = Math.min(Math.max(0.0, groundwaterM3), ctx.demandM3());
        double municipal = Math.max(0.0, ctx.demandM3() - gw);
        double energy = gw * ctx.totalEnergyPerM3();
        double cost = gw * chargedGroundwaterCostPerM3 + municipal * ctx.municipalPricePerM3();
        WaterDecision decision = new WaterDecision(reason, chargedGroundwaterCostPerM3,
                ctx.municipalPricePerM3(), constraintHit, limitingFactor);
        return new WaterAllocation(gw, municipal, energy, cost, decision);
    }

    protected static String withConstraint(String reason, ConstraintType constraintHit) {
        return constraintHit == null ? reason : reason + "_but_" + constraintHit.getCode();
    }

    protected static String codeOf(ConstraintType constraintHit) {
        return constraintHit == null ? null : constraintHit.getCode();
    }
}
