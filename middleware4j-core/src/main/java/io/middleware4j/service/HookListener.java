package io.middleware4j.service;

import java.util.List;

@FunctionalInterface
public interface HookListener {

    void call(List<Object> args) throws Exception;
}
