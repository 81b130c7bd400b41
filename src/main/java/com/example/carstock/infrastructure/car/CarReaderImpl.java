package com.example.carstock.infrastructure.car;

import com.example.carstock.car.CarReader;
import com.example.carstock.car.domain.CarEntity;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import java.util.List;

@Repository

public class CarReaderImpl implements CarReader {

    private final CarRepository carRepository;

    public CarReaderImpl(CarRepository carRepository) {
        this.carRepository = carRepository;
    }

    public List<CarEntity> findAll(int dealerId){
        return carRepository.findAllByDealerId(dealerId);
    }

    public List<CarEntity> search(int dealerId, String make, String model){
        Specification<CarEntity> spec = CarSpecifications.ownedBy(dealerId);

        if (StringUtils.hasLength(make)) {
            spec = spec.and(CarSpecifications.makeEqualsIgnoreCase(make));
        }
        if (StringUtils.hasLength(model)) {
            spec = spec.and(CarSpecifications.modelEqualsIgnoreCase(model));
        }
        return carRepository.findAll(spec);
    }
}
