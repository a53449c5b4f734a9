package com.example.dubbing_backend.dto;

import jakarta.validation.Valid;

public record ProcessVideoRequest(@Valid DubbingOptions options) {
}
