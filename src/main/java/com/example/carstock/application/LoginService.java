package com.example.carstock.application;

import com.example.carstock.auth.DealerTokenService;
import com.example.carstock.dealer.domain.DealerEntity;
import com.example.carstock.infrastructure.dealer.DealerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
public class LoginService {

    private final DealerRepository dealerRepository;
    private final PasswordEncoder passwordEncoder;
    private final DealerTokenService tokenService;

    // compared against when the dealer is unknown, so both failures cost one hash check
    private final String unknownDealerHash;

    public LoginService(DealerRepository dealerRepository, PasswordEncoder passwordEncoder, DealerTokenService tokenService) {
        this.dealerRepository = dealerRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.unknownDealerHash = passwordEncoder.encode("unknown-dealer");
    }

    @Transactional(readOnly = true)
    public LoginResult login(int dealerId, String password) {
        Optional<DealerEntity> dealer = dealerRepository.findById(dealerId);
        String storedHash = dealer.map(DealerEntity::getHashedPassword).orElse(unknownDealerHash);

        boolean matches = passwordEncoder.matches(password, storedHash);
        if (dealer.isEmpty() || !matches) {
            log.warn("Login rejected for dealer {}", dealerId);
            return LoginResult.invalidCredentials();
        }

        String token = tokenService.issue(dealerId);
        log.info("Dealer {} logged in", dealerId);
        return LoginResult.authenticated(token);
    }
}
