package deformationlab.domain.source;

public enum EditState {
    EDITING,    // Sesión abierta (estado inicial)
    COMMITTED,  // Cerrada con OK (terminal)
    CANCELLED;  // Cerrada con Cancel (terminal)

    public boolean isTerminal() {
        return this != EDITING;
    }
}
