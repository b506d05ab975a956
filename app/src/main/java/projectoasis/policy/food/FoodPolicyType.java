package projectoasis.policy.food;

import lombok.Getter;
import projectoasis.exception.ScenarioConfigurationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registro de políticas de procesado. Algunas aceptan nombres alternativos heredados.
 */
@Getter
public enum FoodPolicyType {

    ALL_FRESH("all_fresh"),
    MAXIMIZE_STORAGE("maximize_storage", "preserve_maximum"),
    BALANCED_MIX("balanced_mix", "balanced"),
    MARKET_RESPONSIVE("market_responsive");

    private final String code;
    private final List<String> aliases;

    FoodPolicyType(String code, String... aliases) {
        this.code = code;
        this.aliases = List.of(aliases);
    }

    // Clave: código o alias -> Valor: ENUM
    private static final Map<String, FoodPolicyType> BY_CODE = new HashMap<>();

    static {
        for (FoodPolicyType type : values()) {
            BY_CODE.put(type.code, type);
            type.aliases.forEach(alias -> BY_CODE.put(alias, type));
        }
    }

    public static FoodPolicyType fromCode(String name) {
        FoodPolicyType type = name == null ? null : BY_CODE.get(name.trim().toLowerCase());
        if (type == null) {
            throw new ScenarioConfigurationException(
                    "Política de procesado desconocida: '" + name + "'. Disponibles: " + BY_CODE.keySet());
        }
        return type;
    }
}
