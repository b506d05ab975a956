package projectoasis.exception;

/**
 * Una consulta obligatoria al proveedor de datos no tiene valor para la clave pedida
 * (curva de riego, precio, factor de capacidad, demanda comunitaria...).
 * <p>
 * El bucle diario no la captura: la simulación entera falla, porque los días siguientes
 * dependen de un estado consistente.
 */
public class MissingDataException extends RuntimeException {

    public MissingDataException(String message) {
        super(message);
    }
}
