package biz.kryukov.dev.svcregistry.parser;

import biz.kryukov.dev.svcregistry.ConfigurationException;
import biz.kryukov.dev.svcregistry.Protocol;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for service URLs such as {@code http://backend:8001/api/health},
 * {@code tcp://10.0.0.5:5900} or {@code redis://redis-host:6379}.
 */
public final class ServiceUrlParser {

    private ServiceUrlParser() {}

    private static final Map<String, Protocol> SCHEME_TO_PROTOCOL = Map.of(
            "http", Protocol.HTTP,
            "https", Protocol.HTTPS,
            "tcp", Protocol.TCP,
            "redis", Protocol.TCP
    );

    private static final int REDIS_DEFAULT_PORT = 6379;

    /**
     * Parses a URL.
     *
     * @param rawUrl URL to parse
     * @return parsed protocol, host, port, path and userinfo password
     * @throws ConfigurationException if the URL is empty, has no or an unsupported scheme,
     *                                or has an invalid host or port
     */
    public static ParsedUrl parse(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new ConfigurationException("URL must not be empty");
        }

        int colonSlashSlash = rawUrl.indexOf("://");
        if (colonSlashSlash < 0) {
            throw new ConfigurationException("URL must have a scheme (e.g. http://): " + rawUrl);
        }
        String scheme = rawUrl.substring(0, colonSlashSlash).toLowerCase(Locale.ROOT);
        Protocol protocol = SCHEME_TO_PROTOCOL.get(scheme);
        if (protocol == null) {
            throw new ConfigurationException("Unsupported URL scheme: " + scheme);
        }
        boolean dataStore = "redis".equals(scheme);

        String rest = rawUrl.substring(colonSlashSlash + 3);

        // Userinfo (user:pass@): only the password is kept
        String password = null;
        int atSign = rest.indexOf('@');
        if (atSign >= 0) {
            String userInfo = rest.substring(0, atSign);
            int colon = userInfo.indexOf(':');
            if (colon >= 0 && colon < userInfo.length() - 1) {
                password = URLDecoder.decode(userInfo.substring(colon + 1), StandardCharsets.UTF_8);
            }
            rest = rest.substring(atSign + 1);
        }

        // Strip query/fragment
        int queryStart = indexOfAny(rest, '?', '#');
        if (queryStart >= 0) {
            rest = rest.substring(0, queryStart);
        }

        int pathStart = rest.indexOf('/');
        String hostPort = pathStart >= 0 ? rest.substring(0, pathStart) : rest;
        String path = pathStart >= 0 ? rest.substring(pathStart) : "";
        if ("/".equals(path) && !protocol.isHttp()) {
            path = "";
        }

        String host;
        String portPart = null;
        if (hostPort.startsWith("[")) {
            // IPv6: [::1]:8080
            int close = hostPort.indexOf(']');
            if (close < 0) {
                throw new ConfigurationException("Invalid IPv6 address in URL: " + rawUrl);
            }
            host = hostPort.substring(1, close);
            String afterBracket = hostPort.substring(close + 1);
            if (afterBracket.startsWith(":")) {
                portPart = afterBracket.substring(1);
            } else if (!afterBracket.isEmpty()) {
                throw new ConfigurationException("Invalid host in URL: " + rawUrl);
            }
        } else {
            int colon = hostPort.lastIndexOf(':');
            if (colon >= 0) {
                host = hostPort.substring(0, colon);
                portPart = hostPort.substring(colon + 1);
            } else {
                host = hostPort;
            }
        }
        if (host.isEmpty()) {
            throw new ConfigurationException("URL has no host: " + rawUrl);
        }

        int port = resolvePort(portPart, protocol, dataStore, rawUrl);
        return new ParsedUrl(protocol, host, port, path, dataStore, password);
    }

    private static int resolvePort(String portPart, Protocol protocol, boolean dataStore,
                                   String rawUrl) {
        if (portPart == null || portPart.isEmpty()) {
            if (dataStore) {
                return REDIS_DEFAULT_PORT;
            }
            if (protocol.defaultPort() > 0) {
                return protocol.defaultPort();
            }
            throw new ConfigurationException("URL must specify a port: " + rawUrl);
        }
        int port;
        try {
            port = Integer.parseInt(portPart);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port in URL: " + rawUrl, e);
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Port out of range in URL: " + rawUrl);
        }
        return port;
    }

    private static int indexOfAny(String s, char a, char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) {
            return ib;
        }
        if (ib < 0) {
            return ia;
        }
        return Math.min(ia, ib);
    }
}
