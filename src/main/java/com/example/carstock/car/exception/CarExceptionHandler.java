package com.example.carstock.car.exception;
import com.example.carstock.application.dto.MessageResponse;
import com.example.carstock.controller.CarController;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(basePackageClasses = CarController.class)
@Order(1)

public class CarExceptionHandler {

    // not found, or owned by another dealer
    @ExceptionHandler(CarNotFoundException.class)
    public ResponseEntity<MessageResponse> handleCarNotFoundException(CarNotFoundException e, HttpServletRequest request) {
        log.debug("{} {} -> {}", request.getMethod(), request.getRequestURI(), e.getErrorCode());
        return new ResponseEntity<>(MessageResponse.of(e.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<MessageResponse> handleUnreadableBody(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.debug("Unreadable body on {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return new ResponseEntity<>(MessageResponse.of("Malformed request body"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<MessageResponse> handleDataAccessException(DataAccessException e, HttpServletRequest request) {
        log.error("Store failure on {} {}", request.getMethod(), request.getRequestURI(), e);
        return new ResponseEntity<>(MessageResponse.of("Database operation failed"), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
