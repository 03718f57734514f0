package com.recoveryos.config;

public final class RequestContext {

    private static final ThreadLocal<String> CLIENT_KEY = new ThreadLocal<>();

    private RequestContext() {}

    public static void setClientKey(String clientKey) {
        CLIENT_KEY.set(clientKey);
    }

    public static String getClientKey() {
        return CLIENT_KEY.get();
    }

    public static void clear() {
        CLIENT_KEY.remove();
    }
}
