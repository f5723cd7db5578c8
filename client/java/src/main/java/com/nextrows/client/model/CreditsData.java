package com.nextrows.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * @param credits remaining credit balance as sent, or null when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreditsData(Double credits) {
}
