package com.example.barshift.override;

public enum OverrideType {
    EXCLUDE,
    ASSIGN,
    CUSTOM_TIME,
    PRIORITIZE
}
