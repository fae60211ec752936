package deformationlab.ui.viewmodel;

import deformationlab.domain.source.CommitController;
import deformationlab.domain.source.SessionAction;
import deformationlab.domain.source.SourceEditorView;
import deformationlab.domain.source.SourceField;
import javafx.beans.property.*;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Estado observable del diálogo de una fuente elipsoidal.
 * <p>
 * Los spinners del formulario se enlazan a estas propiedades. Cada cambio hecho por el usuario
 * se reenvía al {@link CommitController}, que normaliza el valor y lo devuelve vía
 * {@link #displayField}. Los refrescos que vienen del modelo no se reenvían de nuevo.
 * <p>
 * Una instancia por diálogo.
 */
@Slf4j
public class SourceEditorViewModel implements SourceEditorView {

    // --- Posición (m) ---
    public final IntegerProperty easting = new SimpleIntegerProperty();
    public final IntegerProperty northing = new SimpleIntegerProperty();
    public final IntegerProperty depth = new SimpleIntegerProperty();

    // --- Semiejes (m) ---
    public final IntegerProperty dVx = new SimpleIntegerProperty();
    public final IntegerProperty dVy = new SimpleIntegerProperty();
    public final IntegerProperty dVz = new SimpleIntegerProperty();

    // --- Orientación (grados) ---
    public final DoubleProperty rotationX = new SimpleDoubleProperty();
    public final DoubleProperty rotationY = new SimpleDoubleProperty();
    public final DoubleProperty rotationZ = new SimpleDoubleProperty();

    // --- Medio ---
    public final DoubleProperty nu = new SimpleDoubleProperty();

    // --- Derivados / estado del diálogo ---
    private final ReadOnlyDoubleWrapper volume = new ReadOnlyDoubleWrapper();
    private final ReadOnlyBooleanWrapper pendingChanges = new ReadOnlyBooleanWrapper(false);
    private final ReadOnlyBooleanWrapper closeRequested = new ReadOnlyBooleanWrapper(false);

    private final Map<SourceField, Property<Number>> properties = new EnumMap<>(SourceField.class);

    private CommitController controller;

    // Evita reenviar al controlador los valores que él mismo acaba de publicar
    private boolean refreshing = false;

    public SourceEditorViewModel() {
        register(SourceField.EASTING, easting);
        register(SourceField.NORTHING, northing);
        register(SourceField.DEPTH, depth);
        register(SourceField.DV_X, dVx);
        register(SourceField.DV_Y, dVy);
        register(SourceField.DV_Z, dVz);
        register(SourceField.ROTATION_X, rotationX);
        register(SourceField.ROTATION_Y, rotationY);
        register(SourceField.ROTATION_Z, rotationZ);
        register(SourceField.NU, nu);
        properties.put(SourceField.VOLUME, volume);
    }

    /**
     * Conecta el view model con la sesión abierta para él.
     */
    public void attach(CommitController controller) {
        this.controller = controller;
        pendingChanges.set(controller.hasPendingChanges());
    }

    // --- Getters de Propiedades para JavaFX ---
    public ReadOnlyDoubleProperty volumeProperty() { return volume.getReadOnlyProperty(); }
    public ReadOnlyBooleanProperty pendingChangesProperty() { return pendingChanges.getReadOnlyProperty(); }
    public ReadOnlyBooleanProperty closeRequestedProperty() { return closeRequested.getReadOnlyProperty(); }

    public Map<SourceField, Property<Number>> fieldProperties() {
        return Collections.unmodifiableMap(properties);
    }

    // --- Acciones del formulario ---

    public void stepUp(SourceField field) {
        if (controller == null) return;
        controller.reportFieldStep(field, 1);
        updatePendingChanges();
    }

    public void stepDown(SourceField field) {
        if (controller == null) return;
        controller.reportFieldStep(field, -1);
        updatePendingChanges();
    }

    public void apply() {
        fire(SessionAction.APPLY);
    }

    public void ok() {
        fire(SessionAction.OK);
    }

    public void cancel() {
        fire(SessionAction.CANCEL);
    }

    public void resetToDefaults() {
        if (controller == null) return;
        controller.reportReset();
        updatePendingChanges();
    }

    // --- SourceEditorView ---

    @Override
    public void displayField(SourceField field, double value) {
        refreshing = true;
        try {
            if (field == SourceField.VOLUME) {
                volume.set(value);
            } else {
                properties.get(field).setValue(value);
            }
        } finally {
            refreshing = false;
        }
    }

    @Override
    public void requestClose() {
        closeRequested.set(true);
    }

    // --- Internos ---

    private void register(SourceField field, Property<Number> property) {
        properties.put(field, property);
        property.addListener((obs, oldValue, newValue) -> {
            if (refreshing || controller == null || newValue == null) return;
            log.debug("Edición de usuario: {} {} -> {}", field.wireName(), oldValue, newValue);
            controller.reportFieldEdit(field, newValue.doubleValue());
            updatePendingChanges();
        });
    }

    private void fire(SessionAction action) {
        if (controller == null) {
            log.warn("Acción {} sin sesión asociada", action);
            return;
        }
        controller.reportAction(action);
        updatePendingChanges();
    }

    private void updatePendingChanges() {
        pendingChanges.set(controller.hasPendingChanges());
    }
}
