package projectoasis.domain.economics;

import lombok.Getter;

import java.util.List;

/**
 * Caja y totales económicos de la comunidad.
 * <p>
 * El coste anual de infraestructura se calcula una sola vez al inicio; los totales
 * acumulados avanzan en cada cierre de año y con los costes domésticos diarios.
 */
@Getter
public class EconomicState {

    private final List<SubsystemCost> subsystemCosts;
    private final double annualInfrastructureCostUsd;
    private final double annualDebtServiceUsd;

    private double cashReservesUsd;
    private double cumulativeRevenueUsd;
    private double cumulativeOperatingCostUsd;
    private double cumulativeDebtServiceUsd;
    private double cumulativeInfrastructureCostUsd;

    public EconomicState(double initialCashUsd, List<SubsystemCost> subsystemCosts) {
        this.cashReservesUsd = initialCashUsd;
        this.subsystemCosts = List.copyOf(subsystemCosts);
        this.annualInfrastructureCostUsd = this.subsystemCosts.stream()
                .mapToDouble(SubsystemCost::totalAnnualUsd).sum();
        this.annualDebtServiceUsd = this.subsystemCosts.stream()
                .mapToDouble(SubsystemCost::annualDebtServiceUsd).sum();
    }

    /** Coste operativo que no pasa por el cierre anual (agua y electricidad domésticas, diésel). */
    public void addOperatingCost(double costUsd) {
        cumulativeOperatingCostUsd += costUsd;
    }

    /**
     * Cierre económico de un año agrícola.
     *
     * @param cropRevenueUsd    Ingresos por cosechas del año, todas las granjas.
     * @param waterCostUsd      Coste del agua de riego del año.
     * @param fertilizerCostUsd Coste de fertilizante del año.
     */
    public void rollUpYear(double cropRevenueUsd, double waterCostUsd, double fertilizerCostUsd) {
        cumulativeRevenueUsd += cropRevenueUsd;
        cumulativeOperatingCostUsd += waterCostUsd + fertilizerCostUsd + annualInfrastructureCostUsd;
        cumulativeInfrastructureCostUsd += annualInfrastructureCostUsd;
        cumulativeDebtServiceUsd += annualDebtServiceUsd;
        cashReservesUsd += cropRevenueUsd - waterCostUsd - fertilizerCostUsd - annualInfrastructureCostUsd;
    }
}
