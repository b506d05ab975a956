package projectoasis.config;

/**
 * Régimen tarifario: precio plano subvencionado o precio de mercado con escalado anual.
 */
public enum PricingRegime {
    SUBSIDIZED,
    UNSUBSIDIZED
}
