package com.cronix.scheduler.store;

import java.util.Optional;

import com.cronix.scheduler.domain.User;

public interface UserStore {
    Optional<User> findById(String id);

    /**
     * Inserts the user or refreshes email, name and avatar of an existing one.
     */
    User upsert(User user);
}
