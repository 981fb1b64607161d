package com.example.collab.shared.user;

import java.util.Optional;

/**
 * Read-only view of the user records owned by the account service.
 */
public interface UserDirectory {

    Optional<UserRecord> findById(String userId);
}
