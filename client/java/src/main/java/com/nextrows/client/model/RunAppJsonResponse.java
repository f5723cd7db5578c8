package com.nextrows.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of an app run with JSON output: one element per row.
 *
 * @param <T>         row type; {@code Map<String, Object>} (column name to
 *                    cell value) unless the caller binds its own type
 * @param success     whether the run succeeded
 * @param data        the rows, or null when absent
 * @param runId       identifier of this run, or null
 * @param elapsedTime run duration in milliseconds, or null
 * @param error       error message when {@code success} is false, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunAppJsonResponse<T>(boolean success, List<T> data, String runId, Double elapsedTime, String error) {

    public RunAppJsonResponse {
        data = data != null ? Collections.unmodifiableList(new ArrayList<>(data)) : null;
    }
}
