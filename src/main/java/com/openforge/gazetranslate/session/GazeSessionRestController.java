package com.openforge.gazetranslate.session;

import com.openforge.gazetranslate.memory.LanguagePair;
import com.openforge.gazetranslate.memory.MemoryController;
import com.openforge.gazetranslate.session.dto.GazeSessionResponse;
import com.openforge.gazetranslate.session.dto.OpenSessionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Gaze session lifecycle.
 *
 * Endpoints:
 *   POST   /api/gaze/sessions          open a session, returns its STOMP paths
 *   GET    /api/gaze/sessions/{id}     current calibration and capture state
 *   DELETE /api/gaze/sessions/{id}     discard the session and its detector
 */
@RestController
@RequestMapping("/api/gaze/sessions")
@RequiredArgsConstructor
public class GazeSessionRestController {

    private final GazeSessionRegistry registry;

    @PostMapping
    public ResponseEntity<GazeSessionResponse> open(@RequestHeader(MemoryController.OWNER_HEADER) String ownerId,
                                                    @Valid @RequestBody OpenSessionRequest request) {
        GazeSession session = registry.open(
                ownerId,
                LanguagePair.of(request.sourceLang(), request.targetLang()),
                request.gazeMode(),
                request.deviceType());
        return ResponseEntity.status(HttpStatus.CREATED).body(GazeSessionResponse.from(session));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<GazeSessionResponse> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(GazeSessionResponse.from(registry.get(sessionId)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> close(@PathVariable String sessionId) {
        registry.get(sessionId);
        registry.close(sessionId);
        return ResponseEntity.noContent().build();
    }
}
