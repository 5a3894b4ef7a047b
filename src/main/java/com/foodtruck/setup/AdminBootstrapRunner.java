package com.foodtruck.setup;

import com.foodtruck.user.entity.Role;
import com.foodtruck.user.service.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Creates the configured administrator at start-up when the user table is empty.
 * Does nothing unless username, email and password are all configured.
 */
@Slf4j
@Component
public class AdminBootstrapRunner implements ApplicationRunner {

    private final UserService userService;
    private final String username;
    private final String email;
    private final String password;

    public AdminBootstrapRunner(UserService userService,
                                @Value("${foodtruck.bootstrap.admin.username:}") String username,
                                @Value("${foodtruck.bootstrap.admin.email:}") String email,
                                @Value("${foodtruck.bootstrap.admin.password:}") String password) {
        this.userService = userService;
        this.username = username;
        this.email = email;
        this.password = password;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(username) || !StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            log.debug("Admin bootstrap skipped: no admin credentials configured");
            return;
        }
        if (userService.hasAnyUser()) {
            log.info("Admin bootstrap skipped: users already exist");
            return;
        }
        userService.register(username, email, password, "Administrator", Role.ADMIN);
        log.info("Bootstrap admin created: username={}", username);
    }
}
