package com.liveclass.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public class JoinRoomRequest {
    @NotBlank @Size(max = 128)
    public String userId;

    @NotBlank @Size(max = 128)
    public String roomId;

    @Size(max = 100)
    public String name;

    public Role role = Role.STUDENT;
}
