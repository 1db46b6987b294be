package com.cronix.scheduler.domain;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class User {
    String id;
    String email;
    String name;
    String avatarUrl;
    String provider;
    Instant createdAt;
}
