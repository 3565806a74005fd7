package com.di.epistream.change;

public enum ChangeType {
    NEW,
    CHANGED,
    UNCHANGED
}
