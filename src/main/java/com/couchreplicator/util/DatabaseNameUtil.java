package com.couchreplicator.util;

import com.couchreplicator.exception.ConfigException;
import org.apache.commons.lang3.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public class DatabaseNameUtil {

    private static final String SYSTEM_DATABASE_PREFIX = "_";

    public static void validate(String databaseName) throws ConfigException {
        if (StringUtils.isBlank(databaseName)) {
            throw new ConfigException("validate failed. databaseName is blank");
        }
    }

    public static boolean isSystemDatabase(String databaseName) {
        return StringUtils.startsWith(databaseName, SYSTEM_DATABASE_PREFIX);
    }

    // form encoding, "/" becomes "%2F" so the name stays one path segment
    public static String encode(String databaseName) {
        return URLEncoder.encode(databaseName, StandardCharsets.UTF_8);
    }
}
