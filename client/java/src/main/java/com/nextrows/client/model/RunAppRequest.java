package com.nextrows.client.model;

import java.util.Arrays;
import java.util.List;

/**
 * Request to run a published app. Used for both JSON and table output.
 *
 * <p>
 * Inputs keep their order; duplicate keys are sent as given.
 *
 * @param appId  the published app id
 * @param inputs the app inputs, possibly empty
 */
public record RunAppRequest(String appId, List<AppInput> inputs) {

    public RunAppRequest {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
    }

    public static RunAppRequest of(String appId, AppInput... inputs) {
        return new RunAppRequest(appId, Arrays.asList(inputs));
    }
}
