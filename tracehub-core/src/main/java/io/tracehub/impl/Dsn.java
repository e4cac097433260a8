/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.tracehub.impl;

import javax.annotation.Nullable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The destination identifier, which determines where events are sent to and how they are authenticated.
 * <pre>
 * {protocol}://{publicKey}[:{secret}]@{host}[:{port}]/{path/}{projectId}
 * </pre>
 */
public class Dsn {

    private static final Pattern DSN_PATTERN = Pattern.compile("^(?:(\\w+):)//(?:(\\w+)(?::(\\w+))?@)([\\w.-]+)(?::(\\d+))?/(.+)");

    private final String protocol;
    private final String publicKey;
    @Nullable
    private final String secret;
    private final String host;
    @Nullable
    private final String port;
    private final String path;
    private final String projectId;

    private Dsn(String protocol, String publicKey, @Nullable String secret, String host, @Nullable String port,
                String path, String projectId) {
        this.protocol = protocol;
        this.publicKey = publicKey;
        this.secret = secret;
        this.host = host;
        this.port = port;
        this.path = path;
        this.projectId = projectId;
    }

    /**
     * @param dsn the string representation
     * @return the parsed destination identifier
     * @throws IllegalArgumentException if the value is not a valid destination identifier
     */
    public static Dsn parse(String dsn) {
        final Matcher matcher = DSN_PATTERN.matcher(dsn.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid Dsn: " + dsn);
        }
        final String protocol = matcher.group(1);
        if (!"http".equals(protocol) && !"https".equals(protocol)) {
            throw new IllegalArgumentException("Invalid Dsn: Invalid protocol " + protocol);
        }
        String path = "";
        String projectId = matcher.group(6);
        final int lastSlash = projectId.lastIndexOf('/');
        if (lastSlash >= 0) {
            path = projectId.substring(0, lastSlash);
            projectId = projectId.substring(lastSlash + 1);
        }
        if (projectId.isEmpty() || !isNumeric(projectId)) {
            throw new IllegalArgumentException("Invalid Dsn: Invalid projectId " + projectId);
        }
        return new Dsn(protocol, matcher.group(2), matcher.group(3), matcher.group(4), matcher.group(5), path, projectId);
    }

    private static boolean isNumeric(String s) {
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    public String getProtocol() {
        return protocol;
    }

    public String getPublicKey() {
        return publicKey;
    }

    @Nullable
    public String getSecret() {
        return secret;
    }

    public String getHost() {
        return host;
    }

    @Nullable
    public String getPort() {
        return port;
    }

    /**
     * @return the path in front of the project id, without leading and trailing slashes, possibly empty
     */
    public String getPath() {
        return path;
    }

    public String getProjectId() {
        return projectId;
    }

    /**
     * Renders this destination identifier without the secret
     */
    @Override
    public String toString() {
        return toString(false);
    }

    public String toString(boolean withSecret) {
        final StringBuilder sb = new StringBuilder();
        sb.append(protocol).append("://").append(publicKey);
        if (withSecret && secret != null) {
            sb.append(':').append(secret);
        }
        sb.append('@').append(host);
        if (port != null) {
            sb.append(':').append(port);
        }
        sb.append('/');
        if (!path.isEmpty()) {
            sb.append(path).append('/');
        }
        return sb.append(projectId).toString();
    }
}
