package com.example.rcaengine.topology;

public enum DependencyKind {
    SYNC, ASYNC, OPTIONAL
}
