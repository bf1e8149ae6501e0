package com.portfolio.mirror.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetupPersonRequest {

    @NotBlank(message = "Person name is required")
    private String personName;

    @NotBlank(message = "Refresh token is required")
    private String refreshToken;

    private String displayName;
}
