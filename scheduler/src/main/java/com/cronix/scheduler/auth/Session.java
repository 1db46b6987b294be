package com.cronix.scheduler.auth;

import lombok.Value;

/**
 * The authenticated caller of an API request.
 */
@Value
public class Session {
    String userId;
    String email;
}
