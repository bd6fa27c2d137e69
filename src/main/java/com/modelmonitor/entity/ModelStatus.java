package com.modelmonitor.entity;

public enum ModelStatus {
    ACTIVE,
    ARCHIVED
}
