package com.example.carstock.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "password")
public class LoginRequestDto {
    // 1000-9999
    @NotBlank(message = "DealerId is required.")
    @Pattern(regexp = "[1-9][0-9]{3}", message = "DealerId must be a four-digit number.")
    private String dealerId;

    @NotBlank(message = "Password is required.")
    private String password;
}
