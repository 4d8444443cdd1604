package com.openparking.parking.security;

import com.openparking.parking.domain.model.Role;
import com.openparking.parking.domain.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

class JwtUtilsTest {

    private static final String SECRET = secret('k');
    private static final User ALICE = User.builder().id(42L).email("alice@example.com").role(Role.USER).build();

    private static String secret(char fill) {
        return Base64.getEncoder().encodeToString(String.valueOf(fill).repeat(64).getBytes());
    }

    @Test
    @DisplayName("a freshly issued token yields the user id")
    void issuedTokenIsValid() {
        JwtUtils jwtUtils = new JwtUtils(SECRET, 60_000);

        assertThat(jwtUtils.getUserId(jwtUtils.generateToken(ALICE))).contains(42L);
    }

    @Test
    @DisplayName("a tampered token is rejected")
    void tamperedToken() {
        JwtUtils jwtUtils = new JwtUtils(SECRET, 60_000);
        String token = jwtUtils.generateToken(ALICE);
        String tampered = token.substring(0, token.length() - 4) + (token.endsWith("AAAA") ? "BBBB" : "AAAA");

        assertThat(jwtUtils.getUserId(tampered)).isEmpty();
    }

    @Test
    @DisplayName("a token signed with another key is rejected")
    void otherKey() {
        String token = new JwtUtils(secret('x'), 60_000).generateToken(ALICE);

        assertThat(new JwtUtils(SECRET, 60_000).getUserId(token)).isEmpty();
    }

    @Test
    @DisplayName("an expired token is rejected")
    void expiredToken() {
        JwtUtils expired = new JwtUtils(SECRET, -60_000);

        assertThat(expired.getUserId(expired.generateToken(ALICE))).isEmpty();
    }

    @Test
    @DisplayName("garbage and empty input are rejected")
    void malformed() {
        JwtUtils jwtUtils = new JwtUtils(SECRET, 60_000);

        assertThat(jwtUtils.getUserId("not-a-jwt")).isEmpty();
        assertThat(jwtUtils.getUserId("")).isEmpty();
    }
}
