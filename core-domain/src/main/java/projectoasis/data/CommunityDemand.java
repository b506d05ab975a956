package projectoasis.data;

/**
 * Demanda doméstica diaria de la comunidad (viviendas y edificios comunitarios).
 */
public record CommunityDemand(double householdKwh, double buildingKwh, double householdM3, double buildingM3) {

    public static final CommunityDemand NONE = new CommunityDemand(0.0, 0.0, 0.0, 0.0);

    public double totalKwh() {
        return householdKwh + buildingKwh;
    }

    public double totalM3() {
        return householdM3 + buildingM3;
    }
}
