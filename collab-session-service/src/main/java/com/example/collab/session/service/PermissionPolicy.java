package com.example.collab.session.service;

import com.example.collab.session.model.ParticipantRole;
import com.example.collab.session.model.RoomKind;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role based access to room operations. Owners may do anything, editors anything outside
 * {@code admin.*}, viewers only {@code view.*}.
 */
@Component
public class PermissionPolicy {

    private static final Map<RoomKind, Map<ParticipantRole, List<String>>> DEFAULT_PERMISSIONS = new EnumMap<>(RoomKind.class);

    static {
        DEFAULT_PERMISSIONS.put(RoomKind.DOCUMENT, table(
                List.of("read", "write", "admin", "share", "delete"),
                List.of("read", "write", "share")));
        DEFAULT_PERMISSIONS.put(RoomKind.CHAT, table(
                List.of("read", "write", "admin", "delete", "ban"),
                List.of("read", "write")));
        DEFAULT_PERMISSIONS.put(RoomKind.WHITEBOARD, table(
                List.of("read", "write", "admin", "share", "delete"),
                List.of("read", "write")));
        DEFAULT_PERMISSIONS.put(RoomKind.CODE, table(
                List.of("read", "write", "admin", "execute", "share"),
                List.of("read", "write", "execute")));
    }

    public boolean hasPermission(ParticipantRole role, String operation) {
        if (role == null || operation == null) {
            return false;
        }
        switch (role) {
            case OWNER:
                return true;
            case EDITOR:
                return !operation.startsWith("admin.");
            case VIEWER:
                return operation.startsWith("view.");
            default:
                return false;
        }
    }

    public Set<String> defaultPermissions(RoomKind kind, ParticipantRole role) {
        List<String> permissions = DEFAULT_PERMISSIONS
                .getOrDefault(kind, Collections.emptyMap())
                .getOrDefault(role, List.of("read"));
        return new LinkedHashSet<>(permissions);
    }

    private static Map<ParticipantRole, List<String>> table(List<String> owner, List<String> editor) {
        Map<ParticipantRole, List<String>> byRole = new EnumMap<>(ParticipantRole.class);
        byRole.put(ParticipantRole.OWNER, owner);
        byRole.put(ParticipantRole.EDITOR, editor);
        byRole.put(ParticipantRole.VIEWER, List.of("read"));
        return byRole;
    }
}
