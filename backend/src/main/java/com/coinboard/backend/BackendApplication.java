package com.coinboard.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.coinboard.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[curl 시나리오 테스트]  (가입/로그인/refresh/me/sessions/logout 흐름 검증)
================================================================================
# 회원가입 201
curl -i -X POST "http://localhost:8080/api/auth/register" \
  -H "Content-Type: application/json" \
  -d '{"username":"alice","email":"a@x.com","password":"Abc123!@","firstName":"Alice","lastName":"Kim"}'
- 바디: {"user":{...},"tokens":{"accessToken":"...","refreshToken":"..."}}
- 인증 메일은 커밋 이후 발송된다 (MailHog: http://localhost:8025/)

# 로그인 200
curl -i -X POST "http://localhost:8080/api/auth/login" \
  -H "Content-Type: application/json" \
  -d '{"email":"a@x.com","password":"Abc123!@"}'
- 5회 연속 실패하면 15분 동안 423 ACCOUNT_LOCKED

# refresh 200 (로테이션: 기존 refresh는 ROTATED로 폐기)
curl -i -X POST "http://localhost:8080/api/auth/refresh" \
  -H "Content-Type: application/json" \
  -d '{"refreshToken":"<refresh>"}'

# 내 정보 / 세션 목록
curl -i "http://localhost:8080/api/auth/me" -H "Authorization: Bearer <access>"
curl -i "http://localhost:8080/api/auth/sessions" -H "Authorization: Bearer <access>"

# 로그아웃 204 / 전체 로그아웃 204
curl -i -X POST "http://localhost:8080/api/auth/logout" \
  -H "Authorization: Bearer <access>" -H "Content-Type: application/json" \
  -d '{"refreshToken":"<refresh>"}'
curl -i -X POST "http://localhost:8080/api/auth/logout-all" -H "Authorization: Bearer <access>"

================================================================================
[DB 확인]
================================================================================
docker exec -i coinboard-mysql mysql -ucoinboard -pcoinboard coinboard -e "select * from users;"
docker exec -i coinboard-mysql mysql -ucoinboard -pcoinboard coinboard -e "select * from refresh_sessions;"
*/

/**
 * 애플리케이션 엔트리포인트
 *
 * - com.coinboard.backend 하위(auth, security, global)를 컴포넌트 스캔한다.
 * - JWT 방식이므로 기본 인메모리 유저를 만드는 UserDetailsServiceAutoConfiguration은 끈다.
 *
 * 설정 값 주입 흐름:
 *    (OS 환경변수) -> application.yml -> @ConfigurationProperties(@Validated, 위반 시 부팅 실패)
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
