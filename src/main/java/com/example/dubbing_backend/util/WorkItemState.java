package com.example.dubbing_backend.util;

public enum WorkItemState {
    PENDING,
    CLAIMED,
    DONE,
    DEAD,
    REMOVED
}
