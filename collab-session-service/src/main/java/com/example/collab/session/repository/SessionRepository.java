package com.example.collab.session.repository;

import com.example.collab.session.model.Session;
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
public class SessionRepository {

    static final String PREFIX = "session:";

    private final DurableStore store;

    public Optional<Session> findById(String sessionId) {
        return store.get(PREFIX + sessionId, Session.class);
    }

    public void save(Session session) {
        store.put(PREFIX + session.getId(), session);
    }

    public boolean delete(String sessionId) {
        return store.delete(PREFIX + sessionId);
    }

    public List<String> findAllIds() {
        return store.keys(PREFIX).stream()
                .map(key -> key.substring(PREFIX.length()))
                .sorted()
                .collect(Collectors.toList());
    }
}
