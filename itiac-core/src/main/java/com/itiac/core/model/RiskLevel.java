package com.itiac.core.model;

/**
 * Discrete risk label derived from a business impact score.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
