package net.kairos.core.service;

import java.security.SecureRandom;
import java.util.Base64;

/** 실행 id: 16바이트 난수, URL-safe base64 (패딩 없음) */
public final class ExecutionIds {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private ExecutionIds() {}

    public static String newId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
