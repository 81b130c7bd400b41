package com.example.carstock.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CarRequestDto {
    @NotBlank(message = "Make is required.")
    @Size(max = 50, message = "Make can't be longer than 50 characters.")
    private String make;

    @NotBlank(message = "Model is required.")
    @Size(max = 50, message = "Model can't be longer than 50 characters.")
    private String model;

    @NotNull(message = "Year is required.")
    @Min(value = 1900, message = "Year must be between 1900 and 2024.")
    @Max(value = 2024, message = "Year must be between 1900 and 2024.")
    private Integer year;

    @NotNull(message = "Stock level is required.")
    @Min(value = 0, message = "Stock level must be a positive number.")
    private Integer stockLevel;
}
