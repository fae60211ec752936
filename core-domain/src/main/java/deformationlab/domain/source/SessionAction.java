package deformationlab.domain.source;

/**
 * Botones del diálogo de edición.
 */
public enum SessionAction {
    /**
     * Confirma y publica los cambios; la sesión sigue abierta.
     */
    APPLY,

    /**
     * Confirma, publica y cierra la sesión.
     */
    OK,

    /**
     * Descarta los cambios no aplicados y cierra la sesión.
     */
    CANCEL
}
