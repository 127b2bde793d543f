/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.subbridge.common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${key}} and {@code ${key:defaultValue}} placeholders in subscriber
 * configuration values. Lookup order:
 *
 * <ol>
 *   <li>JVM system properties ({@code -Dkey=value})</li>
 *   <li>the backing {@link Properties}</li>
 *   <li>environment variables</li>
 *   <li>the inline default after the first un-escaped colon</li>
 * </ol>
 *
 * <p>Use {@code \:} for a literal colon inside a default, e.g.
 * {@code ${pubsub.emulator:localhost\:8085}}.</p>
 */
public class ConfigPropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigPropertyResolver.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final Properties properties;

    public ConfigPropertyResolver() {
        this(new Properties());
    }

    public ConfigPropertyResolver(Properties properties) {
        this.properties = properties != null ? properties : new Properties();
    }

    /**
     * Load extra properties from a classpath resource. Missing resources are ignored.
     */
    public void loadClasspathProperties(String resource) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.debug("Classpath resource {} not found, skipping", resource);
                return;
            }
            properties.load(is);
            log.info("Loaded {} properties from classpath:{}", properties.size(), resource);
        } catch (IOException e) {
            log.warn("Could not load classpath properties {}: {}", resource, e.getMessage());
        }
    }

    /**
     * Read a key from the backing properties and resolve placeholders in its value.
     *
     * @return the resolved value, or {@code defaultValue} when the key is absent
     */
    public String get(String key, String defaultValue) {
        String raw = properties.getProperty(key);
        return raw != null ? resolve(raw) : defaultValue;
    }

    /**
     * Replace every placeholder in {@code value}.
     *
     * @throws ConfigResolutionException if a placeholder has no value and no default
     */
    public String resolve(String value) {
        if (value == null || !value.contains("${")) return value;

        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolveExpression(matcher.group(1))));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String resolveExpression(String expr) {
        String key;
        String defaultValue = null;

        int colonIdx = findUnescapedColon(expr);
        if (colonIdx >= 0) {
            key = expr.substring(0, colonIdx).trim();
            defaultValue = expr.substring(colonIdx + 1).replace("\\:", ":");
        } else {
            key = expr.trim();
        }

        String val = System.getProperty(key);
        if (val == null) val = properties.getProperty(key);
        if (val == null) val = System.getenv(key);
        if (val == null) val = defaultValue;

        if (val == null) {
            throw new ConfigResolutionException("Cannot resolve configuration placeholder ${" + key + "}");
        }
        log.debug("Resolved ${{{}}}", key);
        return val;
    }

    private int findUnescapedColon(String expr) {
        for (int i = 0; i < expr.length(); i++) {
            if (expr.charAt(i) == ':' && (i == 0 || expr.charAt(i - 1) != '\\')) {
                return i;
            }
        }
        return -1;
    }

    /**
     * A placeholder could not be resolved through any source.
     */
    public static class ConfigResolutionException extends RuntimeException {
        public ConfigResolutionException(String message) {
            super(message);
        }
    }
}
