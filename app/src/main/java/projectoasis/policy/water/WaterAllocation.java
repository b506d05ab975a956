package projectoasis.policy.water;

/**
 * Resultado inmutable de una política de agua.
 * Invariante: {@code groundwaterM3 + municipalM3 == demanda del contexto}.
 */
public record WaterAllocation(double groundwaterM3,
                              double municipalM3,
                              double energyUsedKwh,
                              double costUsd,
                              WaterDecision decision) {

    public WaterAllocation {
        if (groundwaterM3 < 0 || municipalM3 < 0) {
            throw new IllegalArgumentException("Los volúmenes asignados no pueden ser negativos.");
        }
    }

    public double totalM3() {
        return groundwaterM3 + municipalM3;
    }
}
