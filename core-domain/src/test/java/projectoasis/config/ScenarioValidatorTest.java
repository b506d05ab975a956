package projectoasis.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectoasis.exception.ScenarioConfigurationException;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioValidatorTest {

    @Test
    @DisplayName("El escenario de pruebas es válido")
    void validate_acceptsTestingScenario() {
        assertThatCode(() -> ScenarioValidator.validate(ScenarioConfig.getTestingScenario()))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Fin anterior al inicio es un error de configuración")
    void validate_rejectsInvertedPeriod() {
        ScenarioConfig config = ScenarioConfig.getTestingScenario()
                .withEndDate(LocalDate.of(2024, 12, 31));

        assertThatThrownBy(() -> ScenarioValidator.validate(config))
                .isInstanceOf(ScenarioConfigurationException.class)
                .hasMessageContaining("fecha de fin");
    }

    @Test
    @DisplayName("Un escenario sin granjas se rechaza")
    void validate_rejectsEmptyFarmList() {
        ScenarioConfig config = ScenarioConfig.getTestingScenario().withFarms(List.of());

        assertThatThrownBy(() -> ScenarioValidator.validate(config))
                .isInstanceOf(ScenarioConfigurationException.class);
    }

    @Test
    @DisplayName("Límites de SOC invertidos se rechazan")
    void validate_rejectsInvertedSocBounds() {
        ScenarioConfig base = ScenarioConfig.getTestingScenario();
        InfrastructureConfig infra = base.getInfrastructure().withBattery(
                base.getInfrastructure().getBattery().withSocMin(0.95));

        assertThatThrownBy(() -> ScenarioValidator.validate(base.withInfrastructure(infra)))
                .isInstanceOf(ScenarioConfigurationException.class)
                .hasMessageContaining("SOC");
    }

    @Test
    @DisplayName("Identificadores de granja duplicados se rechazan")
    void validate_rejectsDuplicateFarmIds() {
        ScenarioConfig base = ScenarioConfig.getTestingScenario();
        FarmConfig first = base.getFarms().get(0);

        assertThatThrownBy(() -> ScenarioValidator.validate(base.withFarms(List.of(first, first))))
                .isInstanceOf(ScenarioConfigurationException.class)
                .hasMessageContaining("duplicado");
    }
}
