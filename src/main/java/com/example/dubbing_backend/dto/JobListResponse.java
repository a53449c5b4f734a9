package com.example.dubbing_backend.dto;

import java.util.List;

public record JobListResponse(long total, List<VideoStatusResponse> jobs) {
}
