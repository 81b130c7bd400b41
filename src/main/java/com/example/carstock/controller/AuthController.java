package com.example.carstock.controller;

import com.example.carstock.application.LoginResult;
import com.example.carstock.application.LoginService;
import com.example.carstock.application.dto.MessageResponse;
import com.example.carstock.application.dto.ValidationErrorResponse;
import com.example.carstock.application.validation.RequestValidator;
import com.example.carstock.application.validation.ValidationResult;
import com.example.carstock.auth.AuthCookies;
import com.example.carstock.controller.dto.LoginRequestDto;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthController {

    private final LoginService loginService;
    private final RequestValidator requestValidator;

    // sets the jwt cookie on success
    @PostMapping("/login")
    public ResponseEntity<?> login(
            @RequestBody
            LoginRequestDto loginRequestDto
    ) {
        ValidationResult validation = requestValidator.validate(loginRequestDto);
        if (!validation.passed()) {
            return ResponseEntity.badRequest().body(ValidationErrorResponse.from(validation));
        }

        LoginResult result = loginService.login(
                Integer.parseInt(loginRequestDto.getDealerId()), loginRequestDto.getPassword());
        if (!result.success()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(MessageResponse.of(result.message()));
        }

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, AuthCookies.tokenCookie(result.token()).toString())
                .body(MessageResponse.of(result.message()));
    }
}
