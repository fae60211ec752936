package deformationlab.ui.service;

import deformationlab.domain.source.CommitController;
import deformationlab.domain.source.EllipsoidSource;
import deformationlab.domain.source.SourceEditorView;
import deformationlab.domain.source.SourceParameterModel;
import deformationlab.ui.event.SourceCommittedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Abre sesiones de edición de fuentes elipsoidales.
 * <p>
 * Cada sesión recibe su propio {@link SourceParameterModel}; nunca se comparte estado entre
 * diálogos. Las confirmaciones se publican como {@link SourceCommittedEvent}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceEditorService {

    private final ApplicationEventPublisher eventPublisher;
    private final EllipsoidSource sourceDefaults;

    private final AtomicLong sessionCounter = new AtomicLong();

    /**
     * Sesión para una fuente nueva, inicializada con los valores configurados.
     */
    public CommitController openNew(SourceEditorView view) {
        return open(sourceDefaults, view);
    }

    /**
     * Sesión sobre una fuente existente.
     */
    public CommitController openExisting(EllipsoidSource existing, SourceEditorView view) {
        return open(existing, view);
    }

    private CommitController open(EllipsoidSource initial, SourceEditorView view) {
        long sessionId = sessionCounter.incrementAndGet();
        log.info("Abriendo sesión de edición #{}", sessionId);

        SourceParameterModel model = new SourceParameterModel(initial, sourceDefaults);
        return CommitController.open(model, view,
                committed -> eventPublisher.publishEvent(new SourceCommittedEvent(committed, sessionId)));
    }
}
