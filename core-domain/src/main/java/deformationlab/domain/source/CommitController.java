package deformationlab.domain.source;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Máquina de estados de una sesión de edición (Apply / OK / Cancel).
 * <pre>
 *  EDITING --edición-->  EDITING     (setField / stepField)
 *  EDITING --APPLY-->    EDITING     (commit + notificar)
 *  EDITING --OK-->       COMMITTED   (commit + notificar + cerrar)
 *  EDITING --CANCEL-->   CANCELLED   (discard + cerrar)
 *  COMMITTED | CANCELLED --*--> sin cambios
 * </pre>
 * Todo evento se procesa por completo (normalizar, escribir, refrescar) antes de devolver el
 * control. Pensado para ejecutarse en el hilo de interfaz; no se sincroniza.
 */
@Slf4j
public class CommitController {

    private final SourceParameterModel model;
    private final SourceEditorView view;
    private final SourceCommitListener owner;

    private EditState state = EditState.EDITING;

    public CommitController(SourceParameterModel model, SourceEditorView view, SourceCommitListener owner) {
        this.model = Objects.requireNonNull(model, "model");
        this.view = Objects.requireNonNull(view, "view");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    /**
     * Abre una sesión sobre un modelo propio y sincroniza el formulario con todos los campos.
     */
    public static CommitController open(SourceParameterModel model, SourceEditorView view, SourceCommitListener owner) {
        CommitController controller = new CommitController(model, view, owner);
        controller.displayAll();
        log.debug("Sesión de edición abierta: {}", model.snapshotPending());
        return controller;
    }

    // --- Eventos entrantes ---

    /**
     * El formulario notifica un valor tecleado.
     */
    public void reportFieldEdit(String fieldName, double rawValue) {
        // En estado terminal ni siquiera se resuelve el nombre
        if (ignoredInTerminalState("edición de " + fieldName)) return;
        reportFieldEdit(SourceField.fromName(fieldName), rawValue);
    }

    public void reportFieldEdit(SourceField field, double rawValue) {
        if (ignoredInTerminalState("edición de " + field.wireName())) return;
        double stored = model.setField(field, rawValue);
        refresh(field, stored);
    }

    /**
     * El formulario notifica pulsaciones de flecha o rueda ({@code steps} negativo para bajar).
     */
    public void reportFieldStep(String fieldName, int steps) {
        if (ignoredInTerminalState("paso en " + fieldName)) return;
        reportFieldStep(SourceField.fromName(fieldName), steps);
    }

    public void reportFieldStep(SourceField field, int steps) {
        if (ignoredInTerminalState("paso en " + field.wireName())) return;
        double stored = model.stepField(field, steps);
        refresh(field, stored);
    }

    /**
     * El formulario notifica la pulsación de un botón.
     */
    public void reportAction(SessionAction action) {
        Objects.requireNonNull(action, "action");
        if (ignoredInTerminalState(action.name())) return;

        switch (action) {
            case APPLY -> publish();
            case OK -> {
                publish();
                transitionTo(EditState.COMMITTED);
                view.requestClose();
            }
            case CANCEL -> {
                model.discard();
                log.info("Edición cancelada. Se mantiene {}", model.getCommitted());
                transitionTo(EditState.CANCELLED);
                view.requestClose();
            }
        }
    }

    /**
     * Vuelve a los valores por defecto en el búfer de edición (no confirma).
     */
    public void reportReset() {
        if (ignoredInTerminalState("reset")) return;
        model.resetToDefaults();
        displayAll();
    }

    // --- Consultas ---

    public EditState getState() {
        return state;
    }

    public boolean isOpen() {
        return !state.isTerminal();
    }

    public boolean hasPendingChanges() {
        return model.hasPendingChanges();
    }

    public EllipsoidSource snapshotPending() {
        return model.snapshotPending();
    }

    // --- Internos ---

    private void publish() {
        EllipsoidSource committed = model.commit();
        log.info("Parámetros publicados: {}", committed);
        owner.onCommitted(committed);
    }

    private void refresh(SourceField field, double stored) {
        view.displayField(field, stored);
        if (field.affectsVolume()) {
            view.displayField(SourceField.VOLUME, model.snapshotPending().volume());
        }
    }

    private void displayAll() {
        EllipsoidSource pending = model.snapshotPending();
        for (SourceField field : SourceField.values()) {
            view.displayField(field, field.read(pending));
        }
    }

    private void transitionTo(EditState next) {
        log.debug("Sesión {} -> {}", state, next);
        state = next;
    }

    private boolean ignoredInTerminalState(String event) {
        if (state.isTerminal()) {
            log.warn("Sesión ya cerrada ({}). Se ignora: {}", state, event);
            return true;
        }
        return false;
    }
}
