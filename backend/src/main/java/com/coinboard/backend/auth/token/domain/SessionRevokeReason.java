package com.coinboard.backend.auth.token.domain;

/**
 * 세션(refresh) 폐기 사유
 *
 * ROTATED: 정상 로테이션으로 이전 토큰을 폐기함 (다시 제출되면 재사용 공격으로 간주)
 * LOGOUT: 사용자가 해당 세션만 로그아웃
 * LOGOUT_ALL: 사용자가 모든 세션 로그아웃
 * PASSWORD_RESET: 비밀번호 재설정으로 전체 세션 종료
 * REUSE_DETECTED: ROTATED 토큰 재제출이 감지되어 전체 세션 종료
 */
public enum SessionRevokeReason { ROTATED, LOGOUT, LOGOUT_ALL, PASSWORD_RESET, REUSE_DETECTED }
