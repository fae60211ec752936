package deformationlab.domain.source;

/**
 * Puerto de salida hacia el formulario de edición.
 * <p>
 * El formulario sólo muestra valores y reenvía ediciones; no contiene lógica de dominio.
 */
public interface SourceEditorView {

    /**
     * Refresca el control asociado a un campo con el valor ya normalizado.
     *
     * @param field Campo a refrescar (incluye el volumen derivado).
     * @param value Valor en las unidades del campo.
     */
    void displayField(SourceField field, double value);

    /**
     * Solicita el cierre de la sesión (tras OK o Cancel). El ciclo de vida de la ventana
     * pertenece al formulario.
     */
    void requestClose();
}
