package com.liveclass.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;

@JsonIgnoreProperties(ignoreUnknown = true)
public class VoiceActivityRequest {
    @NotBlank
    public String roomId;

    public boolean isActive;
}
