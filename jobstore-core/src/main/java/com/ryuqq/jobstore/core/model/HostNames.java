package com.ryuqq.jobstore.core.model;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * 로컬 호스트 이름 조회.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public final class HostNames {

    private static final String FALLBACK = "unknown-host";

    private HostNames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 로컬 호스트 이름.
     *
     * <p>DNS 조회가 실패하면 {@code HOSTNAME} 환경 변수, 그것도 없으면 {@code unknown-host}.</p>
     *
     * @return 호스트 이름
     */
    public static String local() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String env = System.getenv("HOSTNAME");
            return env == null || env.isBlank() ? FALLBACK : env;
        }
    }
}
