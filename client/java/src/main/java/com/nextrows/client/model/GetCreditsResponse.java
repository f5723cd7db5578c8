package com.nextrows.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Current credit balance of the authenticated account.
 *
 * @param success whether the lookup succeeded
 * @param data    the balance, or null when absent
 * @param error   error message when {@code success} is false, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GetCreditsResponse(boolean success, CreditsData data, String error) {
}
