package com.example.placescout_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record VideoJobCreateRequest(
        @JsonProperty("video_path") @NotBlank @Size(max = 4096) String videoPath,
        @JsonProperty("location_hint") @Size(max = 512) String locationHint
) {
}
