package com.example.gamesession.event;

import com.example.gamesession.engine.ActionResult;
import com.example.gamesession.engine.GameAction;
import com.example.gamesession.service.BotTakeoverController;
import com.example.gamesession.service.PresenceMonitor;
import com.example.gamesession.support.RecordingHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InboundDispatcherTest {

    private PresenceMonitor presence;
    private BotTakeoverController botTakeover;
    private InboundDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        presence = Mockito.mock(PresenceMonitor.class);
        botTakeover = Mockito.mock(BotTakeoverController.class);
        dispatcher = new InboundDispatcher(presence, botTakeover);
    }

    @Test
    void connectReturnsTheConnectionId() {
        RecordingHandle h = new RecordingHandle("c1");
        when(presence.onConnect("s1", "a", "Alice", h)).thenReturn("c1");

        Optional<String> id = dispatcher.dispatch(new InboundEvent.Connect("s1", "a", "Alice", h));

        assertEquals(Optional.of("c1"), id);
    }

    @Test
    void presenceEventsGoToPresenceMonitor() {
        dispatcher.dispatch(new InboundEvent.Disconnect("c1"));
        dispatcher.dispatch(new InboundEvent.ClientReady("s1", "a"));
        dispatcher.dispatch(new InboundEvent.LeaveSession("s1", "b"));

        verify(presence).onDisconnect("c1");
        verify(presence).onClientReady("s1", "a");
        verify(presence).onLeave("s1", "b");
        verifyNoInteractions(botTakeover);
    }

    @Test
    void submitActionGoesToBotTakeover() {
        GameAction raise = GameAction.of("raise");
        when(botTakeover.submitHumanAction(eq("s1"), eq("a"), any())).thenReturn(ActionResult.rejected(raise, "nope"));

        Optional<String> out = dispatcher.dispatch(new InboundEvent.SubmitAction("s1", "a", raise));

        assertTrue(out.isEmpty());
        verify(botTakeover).submitHumanAction("s1", "a", raise);
        verifyNoInteractions(presence);
    }

    @Test
    void activityIsForwardedToPresenceMonitor() {
        dispatcher.activity("c1");

        verify(presence).onActivity("c1");
        verifyNoInteractions(botTakeover);
    }
}
