package com.cronix.scheduler.api;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobLogResponse {
    private String id;
    private String jobId;
    private Instant startedAt;
    private Instant finishedAt;
    private Long durationMs;
    private String status;
    private Integer responseCode;
    private String error;
    private String responseBody;
    private Integer attempts;
}
