package com.newsroom.core.engine;

/**
 * Decides whether the engine may admit new work on this iteration. In-flight work is never
 * affected by a closed gate.
 */
@FunctionalInterface
public interface AdmissionGate {

    AdmissionGate ALWAYS_OPEN = () -> true;

    boolean isAdmitting();
}
