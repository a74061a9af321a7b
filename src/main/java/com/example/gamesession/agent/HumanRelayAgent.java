package com.example.gamesession.agent;

import com.example.gamesession.engine.ActionResult;
import com.example.gamesession.engine.PhaseState;
import com.example.gamesession.event.OutboundEvent;
import com.example.gamesession.model.ParticipantKey;
import com.example.gamesession.service.SessionBroadcaster;

import java.util.concurrent.CompletableFuture;

/** Pass-through to the participant's live connection; the answer arrives as a submitAction frame. */
public class HumanRelayAgent implements AgentHandle {

    private final ParticipantKey key;
    private final SessionBroadcaster broadcaster;

    public HumanRelayAgent(ParticipantKey key, SessionBroadcaster broadcaster) {
        this.key = key;
        this.broadcaster = broadcaster;
    }

    @Override
    public String participantId() {
        return key.participantId();
    }

    @Override
    public boolean isAutomated() {
        return false;
    }

    @Override
    public CompletableFuture<ActionResult> takeTurn(PhaseState state) {
        broadcaster.sendTo(key, new OutboundEvent.ActionRequested(state));
        return CompletableFuture.completedFuture(ActionResult.relayed());
    }
}
