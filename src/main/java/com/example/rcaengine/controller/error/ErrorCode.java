package com.example.rcaengine.controller.error;

public enum ErrorCode {
    BAD_REQUEST, INCIDENT_NOT_FOUND, NOT_FOUND, ILLEGAL_TRANSITION, INTERNAL_ERROR
}
