package com.example.carstock.car;

import com.example.carstock.car.domain.CarEntity;

import java.util.List;

public interface CarReader  {

    List<CarEntity> findAll(int dealerId);

    /**
     * Cars owned by the dealer, narrowed by case-insensitive make and model
     * equality. A null or empty filter is not applied.
     */
    List<CarEntity> search(int dealerId, String make, String model);
}
