package com.example.realtime.websocket;

import com.example.realtime.domain.Room;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Live room membership for this process. Constructed once at startup and injected into the
 * transport gateway and the delivery handlers.
 *
 * <p>{@link #roomSize(Room)} reads the membership as it is at call time. {@link #unregister(String)}
 * removes a connection from every room before it returns, so a size check made right after a
 * disconnect never counts that connection.
 */
@Slf4j
public class RoomRegistry {

    private final Map<String, SessionBinding> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();
    private final Clock clock;

    public RoomRegistry() {
        this(Clock.systemUTC());
    }

    public RoomRegistry(Clock clock) {
        this.clock = clock;
    }

    public SessionBinding register(LiveConnection connection) {
        SessionBinding binding = new SessionBinding(connection, clock.instant());
        SessionBinding existing = sessions.putIfAbsent(connection.id(), binding);
        if (existing != null) {
            throw new IllegalStateException("Connection " + connection.id() + " is already registered");
        }
        return binding;
    }

    /**
     * Adds the connection to the room. Joining a room twice is a no-op, and joins for a connection
     * that is unknown or already unregistered are discarded.
     *
     * @return true if membership changed
     */
    public boolean join(String connectionId, Room room) {
        SessionBinding binding = sessions.get(connectionId);
        if (binding == null) {
            log.debug("Discarding join of {} for unknown connection {}", room, connectionId);
            return false;
        }
        String name = room.name();
        synchronized (binding) {
            if (!binding.addRoom(name)) {
                return false;
            }
            members.compute(name, (key, current) -> {
                Set<String> set = current != null ? current : ConcurrentHashMap.newKeySet();
                set.add(connectionId);
                return set;
            });
        }
        return true;
    }

    /**
     * Removes the connection from the room. Leaving a room that was not joined is a no-op.
     *
     * @return true if membership changed
     */
    public boolean leave(String connectionId, Room room) {
        SessionBinding binding = sessions.get(connectionId);
        if (binding == null) {
            return false;
        }
        String name = room.name();
        synchronized (binding) {
            if (!binding.removeRoom(name)) {
                return false;
            }
            removeMember(name, connectionId);
        }
        return true;
    }

    /**
     * Drops the connection and all of its memberships.
     *
     * @return names of the rooms the connection held
     */
    public Set<String> unregister(String connectionId) {
        SessionBinding binding = sessions.remove(connectionId);
        if (binding == null) {
            return Set.of();
        }
        Set<String> held;
        synchronized (binding) {
            held = binding.close();
            for (String name : held) {
                removeMember(name, connectionId);
            }
        }
        return held;
    }

    public int roomSize(Room room) {
        Set<String> current = members.get(room.name());
        return current == null ? 0 : current.size();
    }

    public boolean hasMembers(Room room) {
        return roomSize(room) > 0;
    }

    /**
     * Sends {@code data} under {@code event} to every connection currently in the room. An empty
     * room is not an error. A failing send to one connection does not stop the others.
     *
     * @return number of connections the event was handed to
     */
    public int broadcastToRoom(Room room, String event, Object data) {
        Set<String> current = members.get(room.name());
        if (current == null || current.isEmpty()) {
            log.debug("No members in {} for {}", room, event);
            return 0;
        }
        int delivered = 0;
        for (String connectionId : current) {
            SessionBinding binding = sessions.get(connectionId);
            if (binding == null) {
                continue;
            }
            try {
                binding.getConnection().send(event, data);
                delivered++;
            } catch (RuntimeException ex) {
                log.warn("Failed to send {} to connection {} in {}", event, connectionId, room, ex);
            }
        }
        return delivered;
    }

    public Set<String> roomsOf(String connectionId) {
        SessionBinding binding = sessions.get(connectionId);
        return binding == null ? Set.of() : binding.getRooms();
    }

    public boolean isRegistered(String connectionId) {
        return sessions.containsKey(connectionId);
    }

    public int connectionCount() {
        return sessions.size();
    }

    public int roomCount() {
        return members.size();
    }

    /**
     * Unregisters and closes every connection. Used on server shutdown.
     */
    public List<LiveConnection> closeAll() {
        List<LiveConnection> closed = new ArrayList<>();
        for (String connectionId : List.copyOf(sessions.keySet())) {
            SessionBinding binding = sessions.get(connectionId);
            unregister(connectionId);
            if (binding == null) {
                continue;
            }
            try {
                binding.getConnection().close();
            } catch (RuntimeException ex) {
                log.warn("Error closing connection {}", connectionId, ex);
            }
            closed.add(binding.getConnection());
        }
        return closed;
    }

    private void removeMember(String room, String connectionId) {
        members.computeIfPresent(room, (key, current) -> {
            current.remove(connectionId);
            return current.isEmpty() ? null : current;
        });
    }
}
