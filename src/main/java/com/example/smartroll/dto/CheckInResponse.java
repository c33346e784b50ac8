package com.example.smartroll.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Wire payload for every check-in response. Absent fields are omitted.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckInResponse {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    private String status;

    // lower-case outcome name; null for faults that are not outcomes
    private String outcome;

    private String message;

    private String error;

    private String student;

    @JsonProperty("classroom_prefix")
    private String classroomPrefix;

    @JsonProperty("recorded_at")
    private Instant recordedAt;

    private Boolean retryable;
}
