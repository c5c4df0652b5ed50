package io.middleware4j.service;

import java.util.Map;

/**
 * Enriches or reshapes a raw stored record before it reaches a caller. {@code context} is whatever the service's
 * context builder produced for the current batch of rows, or null.
 */
@FunctionalInterface
public interface ExtendTransform {

    Map<String, Object> extend(Map<String, Object> row, Object context) throws Exception;
}
