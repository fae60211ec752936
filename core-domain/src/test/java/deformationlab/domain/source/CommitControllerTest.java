package deformationlab.domain.source;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommitControllerTest {

    @Mock
    private SourceEditorView view;

    @Mock
    private SourceCommitListener owner;

    private SourceParameterModel model;
    private CommitController controller;

    @BeforeEach
    void setUp() {
        model = new SourceParameterModel();
        controller = CommitController.open(model, view, owner);
        // La apertura sincroniza todos los campos; no interesa en el resto de pruebas
        clearInvocations(view);
    }

    @Test
    @DisplayName("Abrir la sesión muestra todos los campos, incluido el volumen")
    void open_displaysEveryField() {
        EllipsoidSource existing = EllipsoidSource.defaults().withDVx(10).withDVy(10).withDVz(10);
        SourceEditorView freshView = mock(SourceEditorView.class);

        CommitController.open(new SourceParameterModel(existing), freshView, owner);

        for (SourceField field : SourceField.values()) {
            verify(freshView).displayField(eq(field), anyDouble());
        }
        verify(freshView).displayField(SourceField.VOLUME, existing.volume());
        verify(freshView, never()).requestClose();
    }

    @Test
    @DisplayName("Estado inicial: EDITING")
    void initialState_isEditing() {
        assertEquals(EditState.EDITING, controller.getState());
        assertTrue(controller.isOpen());
    }

    @Test
    @DisplayName("Editar un semieje refresca el campo y el volumen en el mismo evento")
    void fieldEdit_semiAxisRefreshesVolume() {
        controller.reportFieldEdit("dVx", 10);
        controller.reportFieldEdit("dVy", 5);
        controller.reportFieldEdit("dVz", 4);

        ArgumentCaptor<Double> volumes = ArgumentCaptor.forClass(Double.class);
        verify(view, times(3)).displayField(eq(SourceField.VOLUME), volumes.capture());
        assertEquals(837.76, volumes.getValue(), 0.01);
        verify(view).displayField(SourceField.DV_Z, 4.0);
    }

    @Test
    @DisplayName("Editar un campo que no es semieje no refresca el volumen")
    void fieldEdit_otherFieldDoesNotRefreshVolume() {
        controller.reportFieldEdit("rotation_y", 45);

        verify(view).displayField(SourceField.ROTATION_Y, 45.0);
        verify(view, never()).displayField(eq(SourceField.VOLUME), anyDouble());
        verifyNoInteractions(owner);
    }

    @Test
    @DisplayName("El formulario recibe el valor normalizado, no el bruto")
    void fieldEdit_displaysNormalizedValue() {
        controller.reportFieldEdit("rotation_x", -90);
        controller.reportFieldStep("easting", -1);

        verify(view).displayField(SourceField.ROTATION_X, 270.0);
        verify(view).displayField(SourceField.EASTING, -100.0);
    }

    @Test
    @DisplayName("Escenario: easting en max + un paso -> min")
    void fieldStep_wrapsAtMax() {
        controller.reportFieldEdit("easting", 10_000_000);
        controller.reportFieldStep("easting", 1);

        verify(view).displayField(SourceField.EASTING, -10_000_000.0);
        assertEquals(-10_000_000, controller.snapshotPending().easting());
    }

    @Test
    @DisplayName("Apply confirma, notifica una vez y mantiene la sesión abierta")
    void apply_commitsAndStaysOpen() {
        controller.reportFieldEdit("depth", 2_500);

        controller.reportAction(SessionAction.APPLY);

        ArgumentCaptor<EllipsoidSource> captor = ArgumentCaptor.forClass(EllipsoidSource.class);
        verify(owner, times(1)).onCommitted(captor.capture());
        assertEquals(2_500, captor.getValue().depth());
        assertEquals(model.snapshotPending(), model.getCommitted());
        assertEquals(captor.getValue(), model.getCommitted());
        assertEquals(EditState.EDITING, controller.getState());
        assertFalse(controller.hasPendingChanges());
        verify(view, never()).requestClose();
    }

    @Test
    @DisplayName("OK confirma, notifica y pide el cierre (COMMITTED)")
    void ok_commitsNotifiesAndCloses() {
        controller.reportFieldEdit("northing", -700);

        controller.reportAction(SessionAction.OK);

        InOrder inOrder = inOrder(owner, view);
        inOrder.verify(owner).onCommitted(model.getCommitted());
        inOrder.verify(view).requestClose();
        assertEquals(-700, model.getCommitted().northing());
        assertEquals(EditState.COMMITTED, controller.getState());
        assertFalse(controller.isOpen());
    }

    @Test
    @DisplayName("Escenario: dVx=50 y Cancel -> committed intacto y sin notificación")
    void cancel_discardsWithoutNotifying() {
        int before = model.getCommitted().dVx();

        controller.reportFieldEdit("dVx", 50);
        controller.reportAction(SessionAction.CANCEL);

        assertEquals(before, model.getCommitted().dVx());
        assertEquals(model.getCommitted(), model.snapshotPending());
        verify(owner, never()).onCommitted(any());
        verify(view).requestClose();
        assertEquals(EditState.CANCELLED, controller.getState());
    }

    @Test
    @DisplayName("Cancel tras Apply conserva lo aplicado y descarta sólo lo posterior")
    void cancel_afterApplyKeepsAppliedValues() {
        controller.reportFieldEdit("dVy", 300);
        controller.reportAction(SessionAction.APPLY);
        controller.reportFieldEdit("dVy", 900);

        controller.reportAction(SessionAction.CANCEL);

        assertEquals(300, model.getCommitted().dVy());
        assertEquals(300, model.snapshotPending().dVy());
        verify(owner, times(1)).onCommitted(any());
    }

    @Test
    @DisplayName("Escenario: rotation_z=50 Apply, rotation_z=80 OK -> dos notificaciones (50, 80)")
    void applyThenOk_notifiesTwiceInOrder() {
        controller.reportFieldEdit("rotation_z", 50);
        controller.reportAction(SessionAction.APPLY);
        controller.reportFieldEdit("rotation_z", 80);
        controller.reportAction(SessionAction.OK);

        ArgumentCaptor<EllipsoidSource> captor = ArgumentCaptor.forClass(EllipsoidSource.class);
        verify(owner, times(2)).onCommitted(captor.capture());
        List<EllipsoidSource> published = captor.getAllValues();
        assertEquals(50.0, published.get(0).rotationZ(), 0.0);
        assertEquals(80.0, published.get(1).rotationZ(), 0.0);
        assertEquals(EditState.COMMITTED, controller.getState());
    }

    @Test
    @DisplayName("En estado terminal cualquier evento se ignora en silencio")
    void terminalState_ignoresEveryEvent() {
        controller.reportAction(SessionAction.CANCEL);
        clearInvocations(view, owner);
        EllipsoidSource frozen = model.snapshotPending();

        controller.reportFieldEdit("easting", 1_000);
        controller.reportFieldStep("dVx", 1);
        controller.reportReset();
        controller.reportAction(SessionAction.APPLY);
        controller.reportAction(SessionAction.OK);
        controller.reportAction(SessionAction.CANCEL);

        assertEquals(EditState.CANCELLED, controller.getState());
        assertEquals(frozen, model.snapshotPending());
        verifyNoInteractions(view, owner);
    }

    @Test
    @DisplayName("En estado terminal un nombre de campo desconocido también se ignora")
    void terminalState_ignoresUnknownFieldNames() {
        controller.reportAction(SessionAction.OK);
        clearInvocations(view, owner);

        assertDoesNotThrow(() -> controller.reportFieldEdit("length_x", 10));
        assertDoesNotThrow(() -> controller.reportFieldStep("length_x", 1));

        assertEquals(EditState.COMMITTED, controller.getState());
        verifyNoInteractions(view, owner);
    }

    @Test
    @DisplayName("Tras OK la sesión queda COMMITTED aunque llegue un Cancel")
    void committedState_isTerminal() {
        controller.reportAction(SessionAction.OK);
        controller.reportAction(SessionAction.CANCEL);

        assertEquals(EditState.COMMITTED, controller.getState());
        verify(owner, times(1)).onCommitted(any());
        verify(view, times(1)).requestClose();
    }

    @Test
    @DisplayName("Reset carga los valores por defecto en pending y refresca todo el formulario")
    void reset_reloadsDefaultsIntoPending() {
        SourceParameterModel seeded = new SourceParameterModel(
                EllipsoidSource.defaults().withDepth(4_000), EllipsoidSource.defaults());
        CommitController session = CommitController.open(seeded, view, owner);
        clearInvocations(view);

        session.reportReset();

        assertEquals(0, session.snapshotPending().depth());
        assertEquals(4_000, seeded.getCommitted().depth());
        verify(view).displayField(SourceField.DEPTH, 0.0);
        verify(view, times(SourceField.values().length)).displayField(any(), anyDouble());
        verifyNoInteractions(owner);
    }

    @Test
    @DisplayName("Nombres de campo desconocidos se rechazan sin alterar el estado")
    void unknownField_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> controller.reportFieldEdit("length_x", 10));
        assertThrows(IllegalArgumentException.class, () -> controller.reportFieldEdit("volume", 10));
        assertEquals(EditState.EDITING, controller.getState());
        assertFalse(controller.hasPendingChanges());
    }

    @Test
    @DisplayName("Colaboradores nulos se rechazan al construir")
    void constructor_rejectsNullCollaborators() {
        assertThrows(NullPointerException.class, () -> new CommitController(null, view, owner));
        assertThrows(NullPointerException.class, () -> new CommitController(model, null, owner));
        assertThrows(NullPointerException.class, () -> new CommitController(model, view, null));
    }
}
