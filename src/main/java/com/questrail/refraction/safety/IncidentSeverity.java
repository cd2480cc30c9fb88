package com.questrail.refraction.safety;

public enum IncidentSeverity
{
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
