package com.whereq.cadence.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response for job listing, newest first
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobListResponse {
    private List<JobStatusResponse> jobs;

    private int count;
}
