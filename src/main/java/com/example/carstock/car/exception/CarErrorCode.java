package com.example.carstock.car.exception;

public enum CarErrorCode {

    CAR_NOT_FOUND("Car not found"),
    NO_REGISTERED_CAR("No cars found in the database."),
    NO_MATCHING_CAR("No cars found matching the criteria.");

    private final String message;

    CarErrorCode(String message) {
        this.message = message;
    }

    public String getMessage(){
        return this.message;
    }

}
