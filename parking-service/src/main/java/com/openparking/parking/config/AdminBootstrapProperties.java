package com.openparking.parking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Administrator accounts ensured at start-up ({@code parking.bootstrap.admins}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "parking.bootstrap")
public class AdminBootstrapProperties {

    private List<Admin> admins = new ArrayList<>();

    @Getter
    @Setter
    public static class Admin {
        private String name;
        private String email;
        private String password;
    }
}
