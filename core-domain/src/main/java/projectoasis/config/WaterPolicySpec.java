package projectoasis.config;

import lombok.Builder;
import lombok.With;

/**
 * Selección de la política de agua de una granja: nombre registrado más parámetros.
 */
@Builder
@With
public record WaterPolicySpec(String name, WaterPolicyParameters parameters) {

    public WaterPolicySpec {
        if (parameters == null) {
            parameters = WaterPolicyParameters.defaults();
        }
    }

    public static WaterPolicySpec of(String name) {
        return new WaterPolicySpec(name, WaterPolicyParameters.defaults());
    }
}
