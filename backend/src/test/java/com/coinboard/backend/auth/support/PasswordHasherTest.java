package com.coinboard.backend.auth.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import com.coinboard.backend.global.ApiException;
import com.coinboard.backend.global.ErrorCode;

@DisplayName("[Auth][PasswordHasher] BCrypt 해시/검증 단위 테스트")
class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("hash: 원문과 다르고, 같은 원문도 매번 다른 해시(salt)")
    void hash_is_salted() {
        String a = hasher.hash("Abc123!@");
        String b = hasher.hash("Abc123!@");

        assertThat(a).isNotEqualTo("Abc123!@").startsWith("$2");
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    @DisplayName("verify: 일치 true / 불일치 false / 원문 null false")
    void verify_matches() {
        String hash = hasher.hash("Abc123!@");

        assertThat(hasher.verify("Abc123!@", hash)).isTrue();
        assertThat(hasher.verify("Abc123!#", hash)).isFalse();
        assertThat(hasher.verify(null, hash)).isFalse();
    }

    @Test
    @DisplayName("verify: 저장된 해시가 BCrypt 형식이 아니면 CORRUPT_HASH")
    void verify_corrupt_hash() {
        assertThatThrownBy(() -> hasher.verify("Abc123!@", "not-a-bcrypt-hash"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.CORRUPT_HASH);

        assertThatThrownBy(() -> hasher.verify("Abc123!@", null))
                .isInstanceOf(ApiException.class);
    }

    @Test
    @DisplayName("hash: 빈 원문은 IllegalArgumentException")
    void hash_rejects_empty() {
        assertThatThrownBy(() -> hasher.hash(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("72바이트 경계: 앞 72바이트가 같아도 뒤가 다른 원문은 통과하지 않는다")
    void verify_rejects_input_beyond_bcrypt_limit() {
        // 4 + 3*22 + 2 = 72 bytes (UTF-8)
        String exact = "Aa1!" + "\uAC00".repeat(22) + "Bb";
        String hash = hasher.hash(exact);

        assertThat(hasher.verify(exact, hash)).isTrue();
        assertThat(hasher.verify(exact + "Z", hash)).isFalse();
    }

    @Test
    @DisplayName("hash: 72바이트를 넘는 원문은 IllegalArgumentException")
    void hash_rejects_input_beyond_bcrypt_limit() {
        String tooLong = "Aa1!" + "\uAC00".repeat(30) + "X"; // 95 bytes, 35자

        assertThatThrownBy(() -> hasher.hash(tooLong))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("dummyVerify: 어떤 입력에도 예외 없이 끝난다")
    void dummy_verify_never_throws() {
        assertThatCode(() -> {
            hasher.dummyVerify("anything");
            hasher.dummyVerify(null);
        }).doesNotThrowAnyException();
    }
}
