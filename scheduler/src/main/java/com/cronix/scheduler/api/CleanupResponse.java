package com.cronix.scheduler.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResponse {
    private int deleted;
    private String message;
}
