package deformationlab.domain.source;

/**
 * Notificación unidireccional a la aplicación propietaria de la fuente. Se invoca en Apply y en
 * OK con el nuevo estado confirmado. La respuesta, si la hay, no se interpreta.
 */
@FunctionalInterface
public interface SourceCommitListener {

    void onCommitted(EllipsoidSource committed);
}
