package com.example.placescout_backend.util;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    DONE,
    FAILED
}
