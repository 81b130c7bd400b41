package com.example.carstock.car.exception;

import lombok.Getter;

/**
 * No car visible to the calling dealer. Raised both when the row does not exist
 * and when it belongs to another dealer.
 */
@Getter
public class CarNotFoundException extends RuntimeException {

    private final CarErrorCode errorCode;

    public CarNotFoundException(CarErrorCode carErrorCode) {
        super(carErrorCode.getMessage());
        this.errorCode = carErrorCode;
    }

}
