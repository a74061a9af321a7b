package com.example.gamesession.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Opaque action handed to the rule engine; this server never interprets it. */
public record GameAction(String type, Map<String, Object> params) {

    public static final String PASS = "pass";

    public GameAction {
        Objects.requireNonNull(type, "type");
        params = (params == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static GameAction of(String type) {
        return new GameAction(type, Map.of());
    }

    /** Conservative default: decline / pass. */
    public static GameAction pass() {
        return of(PASS);
    }

    @JsonIgnore
    public boolean isPass() {
        return PASS.equals(type);
    }
}
