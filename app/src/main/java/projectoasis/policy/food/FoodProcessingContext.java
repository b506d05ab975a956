package projectoasis.policy.food;

/**
 * Contexto de la decisión de procesado en el día de cosecha.
 *
 * @param cropName            Cultivo cosechado.
 * @param harvestYieldKg      Cosecha tras el estrés hídrico [kg].
 * @param freshPricePerKg     Precio en fresco del día [USD/kg].
 * @param referencePricePerKg Precio de referencia del proveedor de datos, o {@code null} si no lo hay.
 */
public record FoodProcessingContext(String cropName,
                                    double harvestYieldKg,
                                    double freshPricePerKg,
                                    Double referencePricePerKg) {
}
