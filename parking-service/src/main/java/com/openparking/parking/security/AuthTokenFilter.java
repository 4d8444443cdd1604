package com.openparking.parking.security;

import com.openparking.common.util.Constants;
import com.openparking.parking.domain.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <jwt>}.
 *
 * The account is re-read on every request, so a deleted user's token stops working and a role
 * change takes effect immediately. Requests without a usable token continue unauthenticated
 * and are turned away by the URL rules where authentication is required.
 */
@Slf4j
@RequiredArgsConstructor
public class AuthTokenFilter extends OncePerRequestFilter {

    private final JwtUtils jwtUtils;
    private final UserRepository userRepository;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(Constants.BEARER_PREFIX)) {
            String token = header.substring(Constants.BEARER_PREFIX.length()).trim();
            jwtUtils.getUserId(token)
                    .flatMap(userRepository::findById)
                    .ifPresent(user -> {
                        AuthenticatedUser principal = new AuthenticatedUser(user.getId(), user.getEmail(), user.getRole());
                        var authentication = new UsernamePasswordAuthenticationToken(
                                principal, null, List.of(new SimpleGrantedAuthority(user.getRole().authority())));
                        SecurityContextHolder.getContext().setAuthentication(authentication);
                        log.debug("Authenticated user {} ({})", user.getId(), user.getRole());
                    });
        }
        chain.doFilter(request, response);
    }
}
