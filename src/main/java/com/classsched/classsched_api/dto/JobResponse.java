package com.classsched.classsched_api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State of an asynchronous job. {@code result} is set once solving finished,
 * {@code error} when it failed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {
    private String problemId;
    private String status;
    private ScheduleResponse result;
    private String error;
}
