package com.example.realtime.domain;

import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * A named multicast group. Rendered on the wire and in the registry as {@code kind:id}.
 */
public final class Room {

    private final RoomKind kind;
    private final String id;

    private Room(RoomKind kind, String id) {
        if (kind == null) {
            throw new IllegalArgumentException("Room kind is required");
        }
        if (!StringUtils.hasText(id)) {
            throw new IllegalArgumentException("Room id is required for " + kind.prefix() + " rooms");
        }
        this.kind = kind;
        this.id = id.trim();
    }

    public static Room of(RoomKind kind, String id) {
        return new Room(kind, id);
    }

    public static Room user(String profileId) {
        return new Room(RoomKind.USER, profileId);
    }

    public static Room conversation(String conversationId) {
        return new Room(RoomKind.CONVERSATION, conversationId);
    }

    public static Room community(String communityId) {
        return new Room(RoomKind.COMMUNITY, communityId);
    }

    public static Room booking(String bookingId) {
        return new Room(RoomKind.BOOKING, bookingId);
    }

    public RoomKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public String name() {
        return kind.prefix() + ":" + id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Room other)) {
            return false;
        }
        return kind == other.kind && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return name();
    }
}
