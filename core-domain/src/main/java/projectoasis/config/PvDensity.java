package projectoasis.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import projectoasis.exception.ScenarioConfigurationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Densidad de instalación de los paneles agrivoltaicos sobre el cultivo.
 * Cuanto más densa la instalación, mayor el sombreado mutuo entre filas.
 */
@Getter
@RequiredArgsConstructor
public enum PvDensity {

    LOW("low", 0.95),
    MEDIUM("medium", 0.90),
    HIGH("high", 0.85);

    private final String code;
    private final double shadingFactor;

    // Clave: CÓDIGO normalizado -> Valor: ENUM
    private static final Map<String, PvDensity> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(d -> d.code, d -> d))
    );

    public static PvDensity fromCode(String code) {
        if (code == null) {
            throw new ScenarioConfigurationException("La densidad PV no puede ser nula.");
        }
        PvDensity density = BY_CODE.get(code.trim().toLowerCase());
        if (density == null) {
            throw new ScenarioConfigurationException("Densidad PV desconocida: " + code);
        }
        return density;
    }
}
