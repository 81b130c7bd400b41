package com.example.carstock.controller;

import com.example.carstock.application.CarInventoryService;
import com.example.carstock.application.dto.MessageResponse;
import com.example.carstock.application.dto.ValidationErrorResponse;
import com.example.carstock.application.validation.RequestValidator;
import com.example.carstock.application.validation.ValidationResult;
import com.example.carstock.auth.DealerPrincipal;
import com.example.carstock.car.domain.CarEntity;
import com.example.carstock.controller.dto.CarRequestDto;
import com.example.carstock.controller.dto.DeleteCarRequestDto;
import com.example.carstock.controller.dto.SearchCarRequestDto;
import com.example.carstock.controller.dto.UpdateStockRequestDto;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/cars")
public class CarController {

    private final CarInventoryService carInventoryService;
    private final RequestValidator requestValidator;

    @GetMapping
    public ResponseEntity<List<CarEntity>> getCars(@AuthenticationPrincipal DealerPrincipal dealer) {
        return ResponseEntity.ok(carInventoryService.getCarList(dealer.dealerId()));
    }

    @PostMapping
    public ResponseEntity<?> addCar(
            @AuthenticationPrincipal DealerPrincipal dealer,
            @RequestBody CarRequestDto carRequestDto
    ) {
        ValidationResult validation = requestValidator.validate(carRequestDto);
        if (!validation.passed()) {
            return ResponseEntity.badRequest().body(ValidationErrorResponse.from(validation));
        }

        if (!carInventoryService.addCar(dealer.dealerId(), carRequestDto)) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(MessageResponse.of("Failed to add car"));
        }
        return ResponseEntity.ok(MessageResponse.of("Car added successfully"));
    }

    @DeleteMapping
    public ResponseEntity<?> deleteCar(
            @AuthenticationPrincipal DealerPrincipal dealer,
            @RequestBody DeleteCarRequestDto deleteRequestDto
    ) {
        ValidationResult validation = requestValidator.validate(deleteRequestDto);
        if (!validation.passed()) {
            return ResponseEntity.badRequest().body(ValidationErrorResponse.from(validation));
        }

        carInventoryService.deleteCar(dealer.dealerId(), deleteRequestDto.getId());
        return ResponseEntity.ok(MessageResponse.of("Car deleted successfully"));
    }

    @PutMapping("/stock")
    public ResponseEntity<?> updateCarStockLevel(
            @AuthenticationPrincipal DealerPrincipal dealer,
            @RequestBody UpdateStockRequestDto updateRequestDto
    ) {
        ValidationResult validation = requestValidator.validate(updateRequestDto);
        if (!validation.passed()) {
            return ResponseEntity.badRequest().body(ValidationErrorResponse.from(validation));
        }

        carInventoryService.updateStockLevel(
                dealer.dealerId(), updateRequestDto.getId(), updateRequestDto.getNewStockLevel());
        return ResponseEntity.ok(MessageResponse.of("Stock level updated successfully"));
    }

    @PostMapping("/search")
    public ResponseEntity<?> searchCars(
            @AuthenticationPrincipal DealerPrincipal dealer,
            @RequestBody SearchCarRequestDto searchRequestDto
    ) {
        ValidationResult validation = requestValidator.validate(searchRequestDto);
        if (!validation.passed()) {
            return ResponseEntity.badRequest().body(ValidationErrorResponse.from(validation));
        }

        return ResponseEntity.ok(carInventoryService.searchCars(dealer.dealerId(), searchRequestDto));
    }
}
