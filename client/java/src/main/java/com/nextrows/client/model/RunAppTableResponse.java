package com.nextrows.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of an app run with table output.
 *
 * @param success     whether the run succeeded
 * @param data        columns and rows, or null when absent
 * @param runId       identifier of this run, or null
 * @param elapsedTime run duration in milliseconds, or null
 * @param error       error message when {@code success} is false, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunAppTableResponse(boolean success, RunAppTableData data, String runId, Double elapsedTime,
        String error) {
}
