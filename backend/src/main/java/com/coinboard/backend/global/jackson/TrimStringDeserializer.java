package com.coinboard.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * 식별자 입력(email/username)의 앞뒤 공백을 제거하는 역직렬화기.
 *
 * - 공백만 있는 값은 null로 바꿔서 @NotBlank가 그대로 잡게 한다.
 * - 비밀번호 필드에는 붙이지 않는다. (공백도 비밀번호의 일부로 취급)
 */
public class TrimStringDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String v = p.getValueAsString();
        if (v == null) return null;

        String trimmed = v.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
