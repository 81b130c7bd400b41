package com.example.carstock.controller.dto;

import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Both filters are optional; an empty string behaves like an absent filter.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class SearchCarRequestDto {
    @Size(max = 50, message = "Make can't be longer than 50 characters.")
    private String make;

    @Size(max = 50, message = "Model can't be longer than 50 characters.")
    private String model;
}
