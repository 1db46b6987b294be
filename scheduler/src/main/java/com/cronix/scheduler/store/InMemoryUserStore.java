package com.cronix.scheduler.store;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.cronix.scheduler.domain.User;

public class InMemoryUserStore implements UserStore {
    private final Map<String, User> users = new ConcurrentHashMap<>();

    @Override
    public Optional<User> findById(String id) {
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public User upsert(User user) {
        return users.merge(user.getId(), user, (old, fresh) -> old.toBuilder()
                .email(fresh.getEmail())
                .name(fresh.getName())
                .avatarUrl(fresh.getAvatarUrl())
                .build());
    }
}
