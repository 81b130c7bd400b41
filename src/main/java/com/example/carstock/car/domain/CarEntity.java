package com.example.carstock.car.domain;

import jakarta.persistence.*;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity(name = "Car")
@Table(name = "cars")

public class CarEntity {
    @Id
    @Column(name = "car_id")
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id; // PK

    @Column(nullable = false, length = 50)
    private String make;

    @Column(nullable = false, length = 50)
    private String model;

    @Column(name = "car_year", nullable = false)
    private int year;

    @Column(name = "stock_level", nullable = false)
    private int stockLevel;

    @Column(name = "dealer_id", nullable = false)
    private int dealerId; // owning dealer

}
