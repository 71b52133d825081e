package com.coinboard.backend.auth.identity.me.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.coinboard.backend.auth.identity.dto.UserResponse;
import com.coinboard.backend.auth.repo.UserRepository;
import com.coinboard.backend.global.ApiException;
import com.coinboard.backend.global.ErrorCode;
import com.coinboard.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 내 정보 조회 (읽기 전용)
 * - 토큰은 유효한데 유저 row가 사라졌으면 USER_NOT_FOUND
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public UserResponse me(AuthPrincipal principal) {
        // 필터/EntryPoint에서 막히지만 서비스에서도 한 번 더 확인한다.
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }
        return userRepository.findById(principal.userId())
                .map(UserResponse::from)
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));
    }
}
