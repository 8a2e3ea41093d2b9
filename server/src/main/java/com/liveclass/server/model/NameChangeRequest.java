package com.liveclass.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public class NameChangeRequest {
    @NotBlank
    public String roomId;

    @NotNull @Size(max = 100)
    public String newName;
}
