package com.example.carstock.controller.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class DeleteCarRequestDto {
    @NotNull(message = "Id is required.")
    private Integer id;
}
