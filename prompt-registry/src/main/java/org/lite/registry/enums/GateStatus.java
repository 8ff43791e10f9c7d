package org.lite.registry.enums;

public enum GateStatus {
    PASSED,     // Rule condition holds
    FAILED,     // Blocking rule condition does not hold
    WARNING     // Non-blocking rule condition does not hold
}
