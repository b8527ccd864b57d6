package com.webharvest.core.discovery;

/** 탐색 단계 단위 실패. UrlDiscoverer 가 로그 후 해당 단계만 건너뛴다. */
public class DiscoveryException extends Exception {
    private final String stage;

    public DiscoveryException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public DiscoveryException(String stage, String message) {
        this(stage, message, null);
    }

    public String getStage() { return stage; }
}
