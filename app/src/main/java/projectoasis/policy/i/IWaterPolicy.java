package projectoasis.policy.i;

import projectoasis.policy.water.WaterAllocation;
import projectoasis.policy.water.WaterPolicyContext;

/**
 * Estrategia de asignación de agua de una granja.
 * <p>
 * Se invoca una vez por granja y día: decide qué parte de la demanda se sirve con agua
 * subterránea tratada y qué parte con la red municipal. Las implementaciones son
 * deterministas y sin estado entre llamadas; todo lo que necesitan llega en el contexto.
 */
public interface IWaterPolicy {

    WaterAllocation allocate(WaterPolicyContext context);

    /** Nombre registrado de la política (clave de configuración). */
    String getName();
}
