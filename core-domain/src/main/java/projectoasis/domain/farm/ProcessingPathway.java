package projectoasis.domain.farm;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import projectoasis.exception.ScenarioConfigurationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Vías de comercialización de una cosecha.
 */
@Getter
@RequiredArgsConstructor
public enum ProcessingPathway {

    FRESH("fresh"),
    PACKAGED("packaged"),
    CANNED("canned"),
    DRIED("dried");

    private final String code;

    private static final Map<String, ProcessingPathway> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(p -> p.code, p -> p))
    );

    public static ProcessingPathway fromCode(String code) {
        ProcessingPathway pathway = code == null ? null : BY_CODE.get(code.trim().toLowerCase());
        if (pathway == null) {
            throw new ScenarioConfigurationException("Vía de procesado desconocida: " + code);
        }
        return pathway;
    }

    public boolean isProcessed() {
        return this != FRESH;
    }
}
