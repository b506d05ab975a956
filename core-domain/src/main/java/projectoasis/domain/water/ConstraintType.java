package projectoasis.domain.water;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Límite físico que recortó el volumen subterráneo solicitado por una política.
 */
@Getter
@RequiredArgsConstructor
public enum ConstraintType {

    ENERGY_LIMIT("energy_limit"),
    WELL_LIMIT("well_limit"),
    TREATMENT_LIMIT("treatment_limit");

    private final String code;
}
