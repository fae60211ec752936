package deformationlab.ui.event;

import deformationlab.domain.source.EllipsoidSource;

/**
 * Publicado en cada Apply/OK. La aplicación propietaria lo escucha con {@code @EventListener}
 * y propaga los nuevos parámetros al cálculo del campo de deformación.
 *
 * @param source    Parámetros confirmados.
 * @param sessionId Identificador de la sesión de edición que los confirmó.
 */
public record SourceCommittedEvent(EllipsoidSource source, long sessionId) {
}
