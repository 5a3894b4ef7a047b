package com.foodtruck.user.service;

import com.foodtruck.common.dto.DeletionOutcome;
import com.foodtruck.common.dto.DeletionResponse;
import com.foodtruck.common.dto.PageQuery;
import com.foodtruck.common.dto.PageResponse;
import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.common.security.AccessPolicy;
import com.foodtruck.common.security.AccessResource;
import com.foodtruck.common.security.AuthenticatedUser;
import com.foodtruck.order.repository.OrderRepository;
import com.foodtruck.user.dto.CreateUserRequest;
import com.foodtruck.user.dto.UpdateUserRequest;
import com.foodtruck.user.dto.UserResponse;
import com.foodtruck.user.entity.Role;
import com.foodtruck.user.entity.User;
import com.foodtruck.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import static com.foodtruck.common.security.AccessAction.*;

/**
 * User directory. Admins manage every account; other roles may only read
 * their own.
 *
 * <p>Passwords are hashed here before they reach the entity, and no response
 * built by this service carries the hash.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService {

    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final PasswordEncoder passwordEncoder;
    private final AccessPolicy accessPolicy;

    public PageResponse<UserResponse> listUsers(AuthenticatedUser actor, PageQuery page) {
        accessPolicy.check(actor, AccessResource.USER, READ, false);
        return PageResponse.of(
                userRepository.findAll(page.toPageable(Sort.by("id"))), page, UserResponse::from);
    }

    public UserResponse getUser(AuthenticatedUser actor, Long id) {
        accessPolicy.check(actor, AccessResource.USER, READ, actor.owns(id));
        return UserResponse.from(findUser(id));
    }

    /**
     * The caller's own account. Needs no permission beyond a valid token.
     */
    public UserResponse getCurrentUser(AuthenticatedUser actor) {
        return UserResponse.from(findUser(actor.userId()));
    }

    /**
     * Identity lookup for other components: the user must exist and be active.
     */
    public User getActiveUser(Long id) {
        User user = findUser(id);
        if (!user.isActive()) {
            throw new BusinessException(ErrorCode.USER_INACTIVE, "User " + id + " is inactive");
        }
        return user;
    }

    public boolean hasAnyUser() {
        return userRepository.count() > 0;
    }

    @Transactional
    public UserResponse createUser(AuthenticatedUser actor, CreateUserRequest request) {
        accessPolicy.check(actor, AccessResource.USER, CREATE, false);
        User user = register(request.username(), request.email(), request.password(),
                request.fullName(), request.role());
        return UserResponse.from(user);
    }

    /**
     * Stores a new account with a hashed password. Callers are responsible for
     * authorization; setup and start-up bootstrap use this without an actor.
     */
    @Transactional
    public User register(String username, String email, String rawPassword, String fullName, Role role) {
        if (userRepository.existsByUsername(username)) {
            throw new BusinessException(ErrorCode.DUPLICATE_USERNAME);
        }
        if (userRepository.existsByEmail(email)) {
            throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
        }

        User user = User.builder()
                .username(username)
                .email(email)
                .password(passwordEncoder.encode(rawPassword))
                .fullName(fullName)
                .role(role)
                .build();

        user = userRepository.save(user);
        log.info("User created: userId={}, username={}, role={}", user.getId(), username, role);
        return user;
    }

    /**
     * Partial update. A changed email must stay unique, a new password is
     * hashed and {@code active} toggles the soft-delete flag.
     */
    @Transactional
    public UserResponse updateUser(AuthenticatedUser actor, Long id, UpdateUserRequest request) {
        accessPolicy.check(actor, AccessResource.USER, UPDATE, actor.owns(id));
        User user = findUser(id);

        if (request.email() != null && !request.email().equals(user.getEmail())) {
            if (userRepository.existsByEmailAndIdNot(request.email(), id)) {
                throw new BusinessException(ErrorCode.DUPLICATE_EMAIL);
            }
            user.changeEmail(request.email());
        }
        if (request.fullName() != null) {
            user.changeFullName(request.fullName());
        }
        if (request.password() != null) {
            user.changePassword(passwordEncoder.encode(request.password()));
        }
        if (request.role() != null && request.role() != user.getRole()) {
            log.info("User role changed: userId={}, {} -> {}", id, user.getRole(), request.role());
            user.changeRole(request.role());
        }
        if (request.active() != null) {
            if (request.active()) {
                user.activate();
            } else {
                user.deactivate();
            }
        }

        log.info("User updated: userId={}", id);
        return UserResponse.from(user);
    }

    /**
     * Users who own orders are deactivated so order history keeps a valid owner;
     * everyone else is removed.
     */
    @Transactional
    public DeletionResponse deleteUser(AuthenticatedUser actor, Long id) {
        accessPolicy.check(actor, AccessResource.USER, DELETE, actor.owns(id));
        if (actor.owns(id)) {
            throw new BusinessException(ErrorCode.CANNOT_DELETE_SELF);
        }
        User user = findUser(id);

        if (orderRepository.existsByUserId(id)) {
            user.deactivate();
            log.info("User deactivated (owns orders): userId={}", id);
            return new DeletionResponse(id, DeletionOutcome.DEACTIVATED);
        }

        userRepository.delete(user);
        log.info("User deleted: userId={}", id);
        return new DeletionResponse(id, DeletionOutcome.DELETED);
    }

    private User findUser(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND, "User " + id + " not found"));
    }
}
