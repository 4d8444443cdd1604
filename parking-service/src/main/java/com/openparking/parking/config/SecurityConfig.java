package com.openparking.parking.config;

import com.openparking.common.util.Constants;
import com.openparking.parking.domain.model.Role;
import com.openparking.parking.domain.repository.UserRepository;
import com.openparking.parking.security.AuthTokenFilter;
import com.openparking.parking.security.JsonSecurityErrorHandler;
import com.openparking.parking.security.JwtUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Stateless bearer-token security. URL rules enforce roles; ownership is checked in the services.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String USER = Role.USER.name();
    private static final String ADMIN = Role.ADMIN.name();

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http, JwtUtils jwtUtils, UserRepository userRepository,
                                           JsonSecurityErrorHandler errorHandler) throws Exception {
        String api = Constants.API_PREFIX;
        http
                .csrf(csrf -> csrf.disable())
                .httpBasic(basic -> basic.disable())
                .formLogin(form -> form.disable())
                .sessionManagement(sess -> sess.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint(errorHandler)
                        .accessDeniedHandler(errorHandler))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.POST, api + "/auth/register", api + "/auth/login").permitAll()
                        .requestMatchers("/error").permitAll()
                        .requestMatchers(api + "/users/**").hasRole(ADMIN)
                        .requestMatchers(HttpMethod.POST, api + "/parking-slots/**").hasRole(ADMIN)
                        .requestMatchers(HttpMethod.PUT, api + "/parking-slots/**").hasRole(ADMIN)
                        .requestMatchers(HttpMethod.DELETE, api + "/parking-slots/**").hasRole(ADMIN)
                        .requestMatchers(HttpMethod.PATCH, api + "/slot-requests/*/approve",
                                api + "/slot-requests/*/reject").hasRole(ADMIN)
                        .requestMatchers(HttpMethod.PATCH, api + "/slot-requests/*/cancel").hasRole(USER)
                        .requestMatchers(HttpMethod.POST, api + "/slot-requests").hasRole(USER)
                        .requestMatchers(HttpMethod.PUT, api + "/slot-requests/*").hasRole(USER)
                        .anyRequest().authenticated());

        http.addFilterBefore(new AuthTokenFilter(jwtUtils, userRepository), UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
