package io.middleware4j.service;

import java.util.List;
import java.util.Map;

/**
 * Computes state shared by every {@link ExtendTransform} call of one query, e.g. a lookup table.
 */
@FunctionalInterface
public interface ExtendContextBuilder {

    Object build(List<Map<String, Object>> rows, Map<String, Object> extra) throws Exception;
}
