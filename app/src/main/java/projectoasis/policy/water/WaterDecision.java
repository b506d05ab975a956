package projectoasis.policy.water;

import projectoasis.domain.water.ConstraintType;

/**
 * Metadatos de auditoría de una asignación.
 *
 * @param reason               Etiqueta de la decisión (p.ej. {@code gw_preferred_but_well_limit}).
 * @param groundwaterCostPerM3 Coste unitario subterráneo cargado [USD/m³].
 * @param municipalCostPerM3   Precio municipal del día [USD/m³].
 * @param constraintHit        Límite físico que recortó la petición, o {@code null}.
 * @param limitingFactor       Factor limitante (un límite físico, {@code ratio_cap}, una cuota...), o {@code null}.
 */
public record WaterDecision(String reason,
                            double groundwaterCostPerM3,
                            double municipalCostPerM3,
                            ConstraintType constraintHit,
                            String limitingFactor) {
}
