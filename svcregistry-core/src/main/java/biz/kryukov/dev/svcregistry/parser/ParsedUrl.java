package biz.kryukov.dev.svcregistry.parser;

import biz.kryukov.dev.svcregistry.Protocol;

/**
 * Result of parsing a service URL.
 *
 * @param protocol  protocol derived from the scheme
 * @param host      host (without IPv6 brackets)
 * @param port      explicit or default port
 * @param path      path component, empty if absent
 * @param dataStore whether the scheme names a data store probed with a ping command
 * @param password  password from the userinfo part, {@code null} if absent
 */
public record ParsedUrl(Protocol protocol, String host, int port, String path,
                        boolean dataStore, String password) {
}
