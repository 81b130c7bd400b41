package com.example.carstock.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.WebUtils;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates the request from the {@code jwt} cookie. A missing or rejected
 * token leaves the request anonymous so the entry point answers 401.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtCookieAuthenticationFilter extends OncePerRequestFilter {

    private final DealerTokenService tokenService;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        Cookie cookie = WebUtils.getCookie(request, AuthCookies.TOKEN_COOKIE);
        if (cookie != null) {
            TokenValidationResult result = tokenService.validate(cookie.getValue());
            if (result.valid()) {
                var authentication = new UsernamePasswordAuthenticationToken(
                        new DealerPrincipal(result.dealerId()), null, List.of());
                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(authentication);
                SecurityContextHolder.setContext(context);
            } else {
                log.debug("{} {}: token rejected ({})", request.getMethod(), request.getRequestURI(), result.reason());
            }
        }
        filterChain.doFilter(request, response);
    }
}
