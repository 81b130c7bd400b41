package com.example.carstock.application;

import com.example.carstock.auth.DealerTokenService;
import com.example.carstock.auth.TokenValidationResult;
import com.example.carstock.config.JwtProperties;
import com.example.carstock.dealer.domain.DealerEntity;
import com.example.carstock.infrastructure.dealer.DealerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LoginServiceTest {

    @Mock
    private DealerRepository dealerRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private DealerTokenService tokenService;
    private LoginService service;

    @BeforeEach
    void setUp() {
        tokenService = new DealerTokenService(
                new JwtProperties("login-test-signing-key-0123456789abcdef", "carstock", "carstock-clients"),
                Clock.systemUTC());
        service = new LoginService(dealerRepository, passwordEncoder, tokenService);
    }

    @Test
    void login_withCorrectPassword_issuesTokenForDealer() {
        when(dealerRepository.findById(1001))
                .thenReturn(Optional.of(new DealerEntity(1001, passwordEncoder.encode("password123"))));

        LoginResult result = service.login(1001, "password123");

        assertTrue(result.success());
        assertEquals("Logged in successfully", result.message());
        TokenValidationResult token = tokenService.validate(result.token());
        assertTrue(token.valid());
        assertEquals(1001, token.dealerId());
    }

    @Test
    void login_withWrongPassword_fails() {
        when(dealerRepository.findById(1001))
                .thenReturn(Optional.of(new DealerEntity(1001, passwordEncoder.encode("password123"))));

        LoginResult result = service.login(1001, "wrong");

        assertFalse(result.success());
        assertNull(result.token());
    }

    @Test
    void login_unknownDealerAndWrongPassword_lookIdentical() {
        when(dealerRepository.findById(1001))
                .thenReturn(Optional.of(new DealerEntity(1001, passwordEncoder.encode("password123"))));
        when(dealerRepository.findById(2002)).thenReturn(Optional.empty());

        LoginResult wrongPassword = service.login(1001, "wrong");
        LoginResult unknownDealer = service.login(2002, "password123");

        assertEquals(wrongPassword, unknownDealer);
        assertEquals("Invalid username or password", unknownDealer.message());
    }

    @Test
    void login_unknownDealer_doesNotMatchPlaceholderPassword() {
        when(dealerRepository.findById(2002)).thenReturn(Optional.empty());

        assertFalse(service.login(2002, "unknown-dealer").success());
    }
}
