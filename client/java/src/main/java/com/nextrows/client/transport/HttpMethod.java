package com.nextrows.client.transport;

/** HTTP methods used by the NextRows API. */
public enum HttpMethod {
    GET,
    POST
}
