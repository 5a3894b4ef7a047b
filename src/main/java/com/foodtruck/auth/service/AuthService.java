package com.foodtruck.auth.service;

import com.foodtruck.auth.dto.TokenRequest;
import com.foodtruck.auth.dto.TokenResponse;
import com.foodtruck.common.exception.BusinessException;
import com.foodtruck.common.exception.ErrorCode;
import com.foodtruck.common.security.JwtTokenProvider;
import com.foodtruck.user.entity.User;
import com.foodtruck.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Exchanges a username and password for a signed access token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AuthService {

    static final String TOKEN_TYPE = "bearer";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    /**
     * Unknown usernames, wrong passwords and inactive accounts all fail with the
     * same {@link ErrorCode#INVALID_CREDENTIALS} so the response does not reveal
     * which accounts exist.
     */
    public TokenResponse issueToken(TokenRequest request) {
        User user = userRepository.findByUsername(request.username())
                .filter(candidate -> passwordEncoder.matches(request.password(), candidate.getPassword()))
                .filter(User::isActive)
                .orElseThrow(() -> {
                    log.warn("Token request rejected: username={}", request.username());
                    return new BusinessException(ErrorCode.INVALID_CREDENTIALS);
                });

        String token = jwtTokenProvider.createToken(user.getId(), user.getRole());
        log.info("Token issued: userId={}, role={}", user.getId(), user.getRole());
        return new TokenResponse(token, TOKEN_TYPE, jwtTokenProvider.getExpirationSeconds(),
                TokenResponse.UserSummary.from(user));
    }
}
