package projectoasis.economics;

import projectoasis.config.FinancingStatus;
import projectoasis.domain.economics.SubsystemCost;

/**
 * Convierte capital y O&amp;M de referencia en cuotas anuales según el perfil de financiación.
 * <p>
 * Préstamo: cuota francesa mensual {@code P·r(1+r)^n / ((1+r)^n − 1)} con {@code r = interés/12}
 * y {@code n = plazo·12}. Compra al contado: amortización lineal a {@value #DEPRECIATION_YEARS} años.
 * Todos los importes se redondean a céntimos.
 */
public class FinancingCalculator {

    public static final int DEPRECIATION_YEARS = 15;

    public double monthlyPayment(double principal, double annualRate, int termYears) {
        if (principal <= 0 || termYears <= 0) {
            return 0.0;
        }
        int months = termYears * 12;
        double monthlyRate = annualRate / 12.0;
        if (monthlyRate == 0.0) {
            return principal / months;
        }
        double factor = Math.pow(1.0 + monthlyRate, months);
        return principal * monthlyRate * factor / (factor - 1.0);
    }

    public SubsystemCost cost(String subsystem, double capitalCostUsd, double annualOmUsd, FinancingStatus financing) {
        FinancingStatus status = financing == null ? FinancingStatus.EXISTING_OWNED : financing;

        double annualCapex;
        double annualDebtService = 0.0;
        if (status.isHasDebt()) {
            annualCapex = monthlyPayment(capitalCostUsd, status.getAnnualInterestRate(), status.getLoanTermYears()) * 12.0;
            annualDebtService = annualCapex;
        } else {
            annualCapex = capitalCostUsd * status.getCapexCostMultiplier() / DEPRECIATION_YEARS;
        }
        double annualOpex = annualOmUsd * status.getOpexCostMultiplier();

        return SubsystemCost.builder()
                .subsystem(subsystem)
                .capitalCostUsd(round2(capitalCostUsd))
                .annualOmUsd(round2(annualOmUsd))
                .financing(status)
                .annualCapexUsd(round2(annualCapex))
                .annualOpexUsd(round2(annualOpex))
                .annualDebtServiceUsd(round2(annualDebtService))
                .build();
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
