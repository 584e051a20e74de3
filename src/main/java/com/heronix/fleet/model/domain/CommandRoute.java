package com.heronix.fleet.model.domain;

import org.springframework.http.HttpMethod;

/**
 * Device API route a logical command is forwarded to.
 */
public record CommandRoute(HttpMethod method, String path) {
}
