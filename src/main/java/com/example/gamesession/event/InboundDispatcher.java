package com.example.gamesession.event;

import com.example.gamesession.engine.ActionResult;
import com.example.gamesession.service.BotTakeoverController;
import com.example.gamesession.service.PresenceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes every inbound event to its component. Exceptions of the target
 * ({@code SessionNotFoundException}, {@code ConnectionNotFoundException}, ...) propagate to the transport.
 */
@Component
public class InboundDispatcher {

    private static final Logger log = LoggerFactory.getLogger(InboundDispatcher.class);

    private final PresenceMonitor presence;
    private final BotTakeoverController botTakeover;

    public InboundDispatcher(PresenceMonitor presence, BotTakeoverController botTakeover) {
        this.presence = presence;
        this.botTakeover = botTakeover;
    }

    /** @return the new connection id for {@code connect}, empty for everything else */
    public Optional<String> dispatch(InboundEvent event) {
        switch (event.kind()) {
            case CONNECT: {
                InboundEvent.Connect c = (InboundEvent.Connect) event;
                return Optional.of(presence.onConnect(c.sessionId(), c.participantId(), c.displayName(), c.handle()));
            }
            case DISCONNECT: {
                presence.onDisconnect(((InboundEvent.Disconnect) event).connectionId());
                return Optional.empty();
            }
            case CLIENT_READY: {
                InboundEvent.ClientReady r = (InboundEvent.ClientReady) event;
                presence.onClientReady(r.sessionId(), r.participantId());
                return Optional.empty();
            }
            case LEAVE_SESSION: {
                InboundEvent.LeaveSession l = (InboundEvent.LeaveSession) event;
                presence.onLeave(l.sessionId(), l.participantId());
                return Optional.empty();
            }
            case SUBMIT_ACTION: {
                InboundEvent.SubmitAction a = (InboundEvent.SubmitAction) event;
                ActionResult result = botTakeover.submitHumanAction(a.sessionId(), a.participantId(), a.action());
                if (!result.isAccepted()) {
                    log.info("ACTION {} session={} participant={} type={} detail={}", result.status(),
                            a.sessionId(), a.participantId(), a.action().type(), result.detail());
                }
                return Optional.empty();
            }
            default:
                throw new IllegalArgumentException("unhandled inbound kind: " + event.kind());
        }
    }

    /** Liveness signal for a connection; sent for every inbound frame before it is decoded. */
    public void activity(String connectionId) {
        presence.onActivity(connectionId);
    }
}
