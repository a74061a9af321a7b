package com.example.gamesession.engine;

/** Outcome of submitting (or relaying) an action. */
public record ActionResult(Status status, GameAction action, String detail) {

    public enum Status { ACCEPTED, REJECTED, RELAYED }

    public static ActionResult accepted(GameAction action) {
        return new ActionResult(Status.ACCEPTED, action, null);
    }

    public static ActionResult rejected(GameAction action, String reason) {
        return new ActionResult(Status.REJECTED, action, reason);
    }

    /** The decision was forwarded to a live human; the engine hears back via submitAction. */
    public static ActionResult relayed() {
        return new ActionResult(Status.RELAYED, null, null);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
