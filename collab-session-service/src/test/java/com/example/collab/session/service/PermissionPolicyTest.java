package com.example.collab.session.service;

import com.example.collab.session.model.ParticipantRole;
import com.example.collab.session.model.RoomKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PermissionPolicyTest {

    private final PermissionPolicy policy = new PermissionPolicy();

    @Test
    void roleChecks() {
        assertThat(policy.hasPermission(ParticipantRole.OWNER, "admin.kick")).isTrue();
        assertThat(policy.hasPermission(ParticipantRole.EDITOR, "edit.text")).isTrue();
        assertThat(policy.hasPermission(ParticipantRole.EDITOR, "admin.kick")).isFalse();
        assertThat(policy.hasPermission(ParticipantRole.VIEWER, "view.cursor")).isTrue();
        assertThat(policy.hasPermission(ParticipantRole.VIEWER, "edit.text")).isFalse();
        assertThat(policy.hasPermission(null, "view.cursor")).isFalse();
    }

    @Test
    void defaultPermissionsByKind() {
        assertThat(policy.defaultPermissions(RoomKind.CODE, ParticipantRole.EDITOR))
                .containsExactly("read", "write", "execute");
        assertThat(policy.defaultPermissions(RoomKind.CHAT, ParticipantRole.OWNER)).contains("ban");
        assertThat(policy.defaultPermissions(RoomKind.DOCUMENT, ParticipantRole.VIEWER)).containsExactly("read");
    }
}
