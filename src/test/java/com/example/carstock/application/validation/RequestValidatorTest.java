package com.example.carstock.application.validation;

import com.example.carstock.controller.dto.CarRequestDto;
import com.example.carstock.controller.dto.DeleteCarRequestDto;
import com.example.carstock.controller.dto.LoginRequestDto;
import com.example.carstock.controller.dto.SearchCarRequestDto;
import com.example.carstock.controller.dto.UpdateStockRequestDto;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Request validation rules")
class RequestValidatorTest {

    private static ValidatorFactory factory;
    private static RequestValidator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = new RequestValidator(factory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    private static CarRequestDto car(String make, String model, Integer year, Integer stockLevel) {
        return CarRequestDto.builder().make(make).model(model).year(year).stockLevel(stockLevel).build();
    }

    @Test
    @DisplayName("Well-formed car passes")
    void testValidCar() {
        ValidationResult result = validator.validate(car("Toyota", "Corolla", 2020, 15));

        assertTrue(result.passed());
        assertTrue(result.errors().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {1900, 2024})
    @DisplayName("Year bounds are inclusive")
    void testYearBoundsAccepted(int year) {
        assertTrue(validator.validate(car("Ford", "Model T", year, 1)).passed());
    }

    @ParameterizedTest
    @ValueSource(ints = {1899, 2025})
    @DisplayName("Year outside 1900-2024 is rejected")
    void testYearOutOfRange(int year) {
        ValidationResult result = validator.validate(car("Ford", "Model T", year, 1));

        assertFalse(result.passed());
        assertEquals("Year must be between 1900 and 2024.", result.errors().get("year"));
    }

    @Test
    @DisplayName("Stock level zero passes, negative fails")
    void testStockLevelBounds() {
        assertTrue(validator.validate(car("Ford", "Focus", 2010, 0)).passed());

        ValidationResult result = validator.validate(car("Ford", "Focus", 2010, -1));
        assertFalse(result.passed());
        assertEquals("Stock level must be a positive number.", result.errors().get("stockLevel"));
    }

    @Test
    @DisplayName("Blank or over-long make and model are rejected")
    void testMakeAndModelLength() {
        String fiftyOne = "x".repeat(51);

        assertTrue(validator.validate(car("x".repeat(50), "x".repeat(50), 2000, 1)).passed());

        ValidationResult result = validator.validate(car(fiftyOne, " ", 2000, 1));
        assertFalse(result.passed());
        assertEquals("Make can't be longer than 50 characters.", result.errors().get("make"));
        assertEquals("Model is required.", result.errors().get("model"));
    }

    @Test
    @DisplayName("Missing numeric fields are reported")
    void testMissingFields() {
        ValidationResult result = validator.validate(car("Honda", "Civic", null, null));

        assertFalse(result.passed());
        assertEquals("Year is required.", result.errors().get("year"));
        assertEquals("Stock level is required.", result.errors().get("stockLevel"));
    }

    @Test
    @DisplayName("Stock update requires id and a non-negative level")
    void testUpdateStock() {
        assertTrue(validator.validate(new UpdateStockRequestDto(7, 0)).passed());

        ValidationResult result = validator.validate(new UpdateStockRequestDto(null, -1));
        assertFalse(result.passed());
        assertTrue(result.errors().containsKey("id"));
        assertEquals("Stock level must be a positive number.", result.errors().get("newStockLevel"));
    }

    @Test
    @DisplayName("Delete requires an id")
    void testDelete() {
        assertTrue(validator.validate(new DeleteCarRequestDto(3)).passed());
        assertFalse(validator.validate(new DeleteCarRequestDto(null)).passed());
    }

    @Test
    @DisplayName("Search filters are optional but bounded")
    void testSearch() {
        assertTrue(validator.validate(new SearchCarRequestDto(null, null)).passed());
        assertTrue(validator.validate(new SearchCarRequestDto("toyota", "")).passed());
        assertFalse(validator.validate(new SearchCarRequestDto("x".repeat(51), null)).passed());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1000", "1001", "9999"})
    @DisplayName("Four-digit dealer ids 1000-9999 pass")
    void testDealerIdAccepted(String dealerId) {
        assertTrue(validator.validate(new LoginRequestDto(dealerId, "password123")).passed());
    }

    @ParameterizedTest
    @ValueSource(strings = {"999", "10000", "0999", "12a4", "-100"})
    @DisplayName("Dealer ids outside 1000-9999 are rejected")
    void testDealerIdRejected(String dealerId) {
        ValidationResult result = validator.validate(new LoginRequestDto(dealerId, "password123"));

        assertFalse(result.passed());
        assertEquals("DealerId must be a four-digit number.", result.errors().get("dealerId"));
    }

    @Test
    @DisplayName("Login requires a password")
    void testPasswordRequired() {
        ValidationResult result = validator.validate(new LoginRequestDto("1001", ""));

        assertFalse(result.passed());
        assertEquals("Password is required.", result.errors().get("password"));
    }

    @Test
    @DisplayName("Null body is a validation failure")
    void testNullBody() {
        assertFalse(validator.validate(null).passed());
    }
}
