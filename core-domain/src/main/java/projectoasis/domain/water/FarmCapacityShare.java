package projectoasis.domain.water;

/**
 * Parte de la capacidad de pozos y de tratamiento asignada a una granja,
 * proporcional a su superficie. Se calcula una sola vez por simulación.
 */
public record FarmCapacityShare(String farmId, double wellCapacityM3Day, double treatmentCapacityM3Day) {
}
