package com.arccatalog.service.integrity;

public enum Severity {
    WARNING,
    ERROR
}
