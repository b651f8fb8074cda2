package com.roomsignal.model;

import java.util.Optional;

/**
 * Result of a join or leave: the room and the participant the operation concerned.
 * A join that moved the participant out of another room also carries that departure.
 */
public class RoomMembership {
    private final Room room;
    private final Participant participant;
    private final RoomMembership previous;

    public RoomMembership(Room room, Participant participant) {
        this(room, participant, null);
    }

    public RoomMembership(Room room, Participant participant, RoomMembership previous) {
        this.room = room;
        this.participant = participant;
        this.previous = previous;
    }

    public Room getRoom() { return room; }

    public Participant getParticipant() { return participant; }

    public Optional<RoomMembership> getPrevious() { return Optional.ofNullable(previous); }
}
