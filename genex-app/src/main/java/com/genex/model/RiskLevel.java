package com.genex.model;

public enum RiskLevel {
    NORMAL,
    CARRIER,
    ELEVATED,
    HIGH,
    UNKNOWN
}
