package com.example.carstock.application;

import com.example.carstock.car.CarReader;
import com.example.carstock.car.domain.CarEntity;
import com.example.carstock.car.exception.CarErrorCode;
import com.example.carstock.car.exception.CarNotFoundException;
import com.example.carstock.controller.dto.CarRequestDto;
import com.example.carstock.controller.dto.SearchCarRequestDto;
import com.example.carstock.infrastructure.car.CarRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Car inventory operations. Every statement is restricted to the calling dealer's
 * rows, so another dealer's car is reported exactly like a missing one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CarInventoryService {

    private final CarReader carReader;
    private final CarRepository carRepository;

    /**
     * @return true when the row was stored
     */
    @Transactional
    public boolean addCar(int dealerId, CarRequestDto carRequestDto) {
        CarEntity car = CarEntity.builder()
                .make(carRequestDto.getMake())
                .model(carRequestDto.getModel())
                .year(carRequestDto.getYear())
                .stockLevel(carRequestDto.getStockLevel())
                .dealerId(dealerId)
                .build();

        CarEntity saved = carRepository.save(car);
        if (saved.getId() == null) {
            log.error("Car insert for dealer {} returned no id", dealerId);
            return false;
        }
        log.info("Dealer {} added car {}", dealerId, saved.getId());
        return true;
    }

    @Transactional
    public void deleteCar(int dealerId, int carId) {
        int deleted = carRepository.deleteByIdAndDealerId(carId, dealerId);
        if (deleted == 0) {
            throw new CarNotFoundException(CarErrorCode.CAR_NOT_FOUND);
        }
        log.info("Dealer {} deleted car {}", dealerId, carId);
    }

    @Transactional(readOnly = true)
    public List<CarEntity> getCarList(int dealerId) {
        List<CarEntity> cars = carReader.findAll(dealerId);
        if (cars.isEmpty()) {
            throw new CarNotFoundException(CarErrorCode.NO_REGISTERED_CAR);
        }
        return cars;
    }

    @Transactional
    public void updateStockLevel(int dealerId, int carId, int newStockLevel) {
        int updated = carRepository.updateStockLevel(carId, dealerId, newStockLevel);
        if (updated == 0) {
            throw new CarNotFoundException(CarErrorCode.CAR_NOT_FOUND);
        }
        log.info("Dealer {} set stock of car {} to {}", dealerId, carId, newStockLevel);
    }

    @Transactional(readOnly = true)
    public List<CarEntity> searchCars(int dealerId, SearchCarRequestDto searchRequestDto) {
        List<CarEntity> cars = carReader.search(dealerId, searchRequestDto.getMake(), searchRequestDto.getModel());
        if (cars.isEmpty()) {
            throw new CarNotFoundException(CarErrorCode.NO_MATCHING_CAR);
        }
        return cars;
    }
}
