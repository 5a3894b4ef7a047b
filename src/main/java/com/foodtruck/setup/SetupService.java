package com.foodtruck.setup;

import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.user.dto.SetupRequest;
import com.foodtruck.user.dto.UserResponse;
import com.foodtruck.user.entity.Role;
import com.foodtruck.user.entity.User;
import com.foodtruck.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * One-time creation of the first administrator on an empty installation.
 * Once any user exists the operation is permanently refused.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SetupService {

    private final UserService userService;

    /**
     * @throws BusinessException {@link ErrorCode#SETUP_ALREADY_COMPLETED} when
     *                           any account already exists
     */
    @Transactional
    public UserResponse createFirstAdmin(SetupRequest request) {
        if (userService.hasAnyUser()) {
            throw new BusinessException(ErrorCode.SETUP_ALREADY_COMPLETED);
        }
        User admin = userService.register(request.username(), request.email(), request.password(),
                request.fullName(), Role.ADMIN);
        log.info("Initial admin created through setup: userId={}", admin.getId());
        return UserResponse.from(admin);
    }
}
