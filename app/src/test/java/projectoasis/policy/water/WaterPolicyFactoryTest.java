package projectoasis.policy.water;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import projectoasis.config.WaterPolicyParameters;
import projectoasis.config.WaterPolicySpec;
import projectoasis.exception.ScenarioConfigurationException;
import projectoasis.policy.i.IWaterPolicy;
import projectoasis.policy.water.impl.CheapestSourcePolicy;
import projectoasis.policy.water.impl.QuotaEnforcedPolicy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaterPolicyFactoryTest {

    private final WaterPolicyFactory factory = new WaterPolicyFactory();

    @ParameterizedTest
    @ValueSource(strings = {"always_groundwater", "always_municipal", "cheapest_source",
            "conserve_groundwater"})
    @DisplayName("Cada nombre registrado construye la política con ese mismo nombre")
    void create_registeredNames(String name) {
        IWaterPolicy policy = factory.create(WaterPolicySpec.of(name));

        assertThat(policy.getName()).isEqualTo(name);
    }

    @Test
    @DisplayName("Los nombres ignoran mayúsculas y espacios")
    void create_isLenientWithCaseAndWhitespace() {
        IWaterPolicy policy = factory.create(WaterPolicySpec.of("  Cheapest_Source "));

        assertThat(policy).isInstanceOf(CheapestSourcePolicy.class);
    }

    @Test
    @DisplayName("Un nombre desconocido falla con ScenarioConfigurationException")
    void create_unknownName() {
        assertThatThrownBy(() -> factory.create(WaterPolicySpec.of("rain_dance")))
                .isInstanceOf(ScenarioConfigurationException.class)
                .hasMessageContaining("rain_dance");
    }

    @Test
    @DisplayName("quota_enforced exige una cuota anual")
    void create_quotaWithoutAnnualQuota() {
        assertThatThrownBy(() -> factory.create(WaterPolicySpec.of("quota_enforced")))
                .isInstanceOf(ScenarioConfigurationException.class);
    }

    @Test
    @DisplayName("quota_enforced recibe cuota y holgura de sus parámetros")
    void create_quotaWithParameters() {
        WaterPolicyParameters params = WaterPolicyParameters.defaults()
                .withAnnualQuotaM3(2400.0)
                .withMonthlyVariance(0.0);

        IWaterPolicy policy = factory.create(new WaterPolicySpec("quota_enforced", params));

        assertThat(policy).isInstanceOf(QuotaEnforcedPolicy.class);
        assertThat(((QuotaEnforcedPolicy) policy).monthlyMaxM3()).isEqualTo(200.0);
    }

    @Test
    @DisplayName("conserve_groundwater rechaza fracciones fuera de [0, 1]")
    void create_conserveWithInvalidRatio() {
        WaterPolicyParameters params = WaterPolicyParameters.defaults().withMaxGroundwaterRatio(1.5);

        assertThatThrownBy(() -> factory.create(new WaterPolicySpec("conserve_groundwater", params)))
                .isInstanceOf(ScenarioConfigurationException.class);
    }
}
