package projectoasis.exception;

/**
 * Error fatal de configuración del escenario.
 * <p>
 * Se lanza antes de simular el primer día (o al crear las siembras) cuando el escenario
 * no es coherente: política desconocida, campos obligatorios ausentes, rangos inválidos
 * o siembras solapadas del mismo cultivo en una granja. Nunca se recupera.
 */
public class ScenarioConfigurationException extends RuntimeException {

    public ScenarioConfigurationException(String message) {
        super(message);
    }

    public ScenarioConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
