package dev.ebullient.mud.model;

public enum Scope {
    ROOM,
    GLOBAL,
    DIRECT
}
