package com.coinboard.backend.auth.domain;

// JWT role 클레임 값. 계층 없이 이름만 쓴다.
public enum UserRole { USER, ADMIN }
