package dev.ebullient.mud.model;

public record Registration(
        RoomView view,
        Event arrival) {
}
