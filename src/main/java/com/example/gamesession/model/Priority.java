package com.example.gamesession.model;

/** Replay priority; CRITICAL entries survive queue eviction while NORMAL ones remain. */
public enum Priority {
    CRITICAL,
    NORMAL
}
