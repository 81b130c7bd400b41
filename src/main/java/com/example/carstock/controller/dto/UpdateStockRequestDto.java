package com.example.carstock.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStockRequestDto {
    @NotNull(message = "Id is required.")
    private Integer id;

    @NotNull(message = "New stock level is required.")
    @Min(value = 0, message = "Stock level must be a positive number.")
    private Integer newStockLevel;
}
