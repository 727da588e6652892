package com.vigil.observe;

public enum EventLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
