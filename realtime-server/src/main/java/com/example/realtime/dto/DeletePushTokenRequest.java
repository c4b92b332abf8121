package com.example.realtime.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DeletePushTokenRequest {

    @NotBlank
    private String token;
}
