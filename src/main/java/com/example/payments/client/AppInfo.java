package com.example.payments.client;

import java.util.Objects;

/**
 * Identifies the application built on the client; rendered into the {@code User-Agent}.
 *
 * @param name application name
 * @param url application homepage, optional
 * @param version application version, optional
 */
public record AppInfo(String name, String url, String version) {

    public AppInfo {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static AppInfo of(String name) {
        return new AppInfo(name, null, null);
    }

    /**
     * Formats as {@code name/version (url)}, leaving out the parts that are unset.
     */
    public String toUserAgent() {
        StringBuilder sb = new StringBuilder(name);
        if (version != null) {
            sb.append('/').append(version);
        }
        if (url != null) {
            sb.append(" (").append(url).append(')');
        }
        return sb.toString();
    }
}
