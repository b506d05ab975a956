package projectoasis.domain.economics;

import lombok.Builder;
import projectoasis.config.FinancingStatus;

/**
 * Coste anual de un subsistema de infraestructura según su perfil de financiación.
 *
 * @param subsystem          Nombre del subsistema (wells, treatment, pv...).
 * @param capitalCostUsd     Coste de capital estimado.
 * @param annualOmUsd        O&amp;M anual de referencia, antes del multiplicador del perfil.
 * @param financing          Perfil de financiación.
 * @param annualCapexUsd     Cuota anual de capital: servicio de deuda o amortización lineal.
 * @param annualOpexUsd      O&amp;M anual a cargo de la comunidad.
 * @param annualDebtServiceUsd Parte de {@code annualCapexUsd} que corresponde a deuda.
 */
@Builder
public record SubsystemCost(String subsystem,
                            double capitalCostUsd,
                            double annualOmUsd,
                            FinancingStatus financing,
                            double annualCapexUsd,
                            double annualOpexUsd,
                            double annualDebtServiceUsd) {

    public double totalAnnualUsd() {
        return annualCapexUsd + annualOpexUsd;
    }
}
