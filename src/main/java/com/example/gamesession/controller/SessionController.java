package com.example.gamesession.controller;

import com.example.gamesession.model.ConnectionHealth;
import com.example.gamesession.model.SessionView;
import com.example.gamesession.service.MessageReplayQueue;
import com.example.gamesession.service.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Session lifecycle over HTTP: create, seat, start, inspect.
 * Realtime traffic goes over the WebSocket; this is for lobbies and operators.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    /** POST /api/sessions {"sessionId":"table-1","slots":4} */
    @PostMapping
    public ResponseEntity<SessionView> create(@Valid @RequestBody CreateSessionRequest req) {
        String id = req.sessionId().trim();
        sessionService.createSession(id, req.slots());
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.requireSnapshot(id));
    }

    /** POST /api/sessions/{id}/participants {"participantId":"p1","name":"Alice","bot":false} */
    @PostMapping("/{sessionId}/participants")
    public SessionView addParticipant(@PathVariable String sessionId,
                                      @Valid @RequestBody ParticipantRequest req) {
        String pid = req.participantId().trim();
        String name = (req.name() == null || req.name().isBlank()) ? pid : req.name().trim();
        if (req.bot()) {
            sessionService.addBot(sessionId, pid, name);
        } else {
            sessionService.join(sessionId, pid, name);
        }
        return sessionService.requireSnapshot(sessionId);
    }

    @PostMapping("/{sessionId}/start")
    public SessionView start(@PathVariable String sessionId) {
        sessionService.startSession(sessionId);
        return sessionService.requireSnapshot(sessionId);
    }

    @GetMapping("/{sessionId}")
    public SessionView get(@PathVariable String sessionId) {
        return sessionService.requireSnapshot(sessionId);
    }

    /** Replay backlog per participant. */
    @GetMapping("/{sessionId}/queues")
    public List<MessageReplayQueue.QueueStats> queues(@PathVariable String sessionId) {
        return sessionService.queueStats(sessionId);
    }

    @GetMapping("/{sessionId}/connections")
    public List<ConnectionHealth> connections(@PathVariable String sessionId) {
        return sessionService.connectionHealth(sessionId);
    }

    public record CreateSessionRequest(@NotBlank String sessionId, @Min(1) @Max(64) int slots) { }

    public record ParticipantRequest(@NotBlank String participantId, String name, boolean bot) { }
}
