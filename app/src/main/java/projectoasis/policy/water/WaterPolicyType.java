package projectoasis.policy.water;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import projectoasis.exception.ScenarioConfigurationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registro de políticas de agua disponibles por nombre de configuración.
 */
@Getter
@RequiredArgsConstructor
public enum WaterPolicyType {

    ALWAYS_GROUNDWATER("always_groundwater"),
    ALWAYS_MUNICIPAL("always_municipal"),
    CHEAPEST_SOURCE("cheapest_source"),
    CONSERVE_GROUNDWATER("conserve_groundwater"),
    QUOTA_ENFORCED("quota_enforced");

    private final String code;

    private static final Map<String, WaterPolicyType> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(type -> type.code, type -> type))
    );

    public static WaterPolicyType fromCode(String name) {
        WaterPolicyType type = name == null ? null : BY_CODE.get(name.trim().toLowerCase());
        if (type == null) {
            throw new ScenarioConfigurationException(
                    "Política de agua desconocida: '" + name + "'. Disponibles: " + BY_CODE.keySet());
        }
        return type;
    }
}
