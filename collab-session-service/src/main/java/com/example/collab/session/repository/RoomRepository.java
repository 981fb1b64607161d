package com.example.collab.session.repository;

import com.example.collab.session.model.Room;
import com.example.collab.shared.aspect.Monitored;
import com.example.collab.shared.store.DurableStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
@Monitored("repository")
public class RoomRepository {

    static final String PREFIX = "room:";

    private final DurableStore store;

    public Optional<Room> findById(String roomId) {
        return store.get(PREFIX + roomId, Room.class);
    }

    public void save(Room room) {
        store.put(PREFIX + room.getId(), room);
    }

    public boolean delete(String roomId) {
        return store.delete(PREFIX + roomId);
    }

    public List<Room> findAll() {
        return store.keys(PREFIX).stream()
                .sorted()
                .map(key -> store.get(key, Room.class))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    public int count() {
        return store.keys(PREFIX).size();
    }
}
