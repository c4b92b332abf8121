package com.example.realtime.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegisterPushTokenRequest {

    @NotBlank
    @Size(max = 512)
    private String token;

    @NotBlank
    private String deviceType;

    @Size(max = 255)
    private String deviceName;
}
