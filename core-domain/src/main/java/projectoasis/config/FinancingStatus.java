package projectoasis.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import projectoasis.exception.ScenarioConfigurationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Perfiles de financiación de un subsistema de infraestructura.
 * <p>
 * Cada perfil fija qué fracción del capital se paga al contado, si existe deuda
 * (plazo e interés anual) y qué fracción del O&amp;M asume la comunidad.
 */
@Getter
@RequiredArgsConstructor
public enum FinancingStatus {

    EXISTING_OWNED("existing_owned", 0.0, false, 0, 0.0, 1.0),
    GRANT_FULL("grant_full", 0.0, false, 0, 0.0, 0.0),
    GRANT_CAPEX("grant_capex", 0.0, false, 0, 0.0, 1.0),
    PURCHASED_CASH("purchased_cash", 1.0, false, 0, 0.0, 1.0),
    LOAN_STANDARD("loan_standard", 0.0, true, 10, 0.06, 1.0),
    LOAN_CONCESSIONAL("loan_concessional", 0.0, true, 15, 0.035, 1.0);

    private final String code;
    private final double capexCostMultiplier;
    private final boolean hasDebt;
    private final int loanTermYears;
    private final double annualInterestRate;
    private final double opexCostMultiplier;

    private static final Map<String, FinancingStatus> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(s -> s.code, s -> s))
    );

    public static FinancingStatus fromCode(String code) {
        if (code == null) {
            throw new ScenarioConfigurationException("El estado de financiación no puede ser nulo.");
        }
        FinancingStatus status = BY_CODE.get(code.trim().toLowerCase());
        if (status == null) {
            throw new ScenarioConfigurationException("Perfil de financiación desconocido: " + code);
        }
        return status;
    }
}
