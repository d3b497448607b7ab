package com.metadata.infrastructure.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.function.Predicate;

/**
 * Picks the host to connect to. The configured host is used as-is unless it does not resolve
 * and the store settings explicitly allow falling back to {@code fallbackHost}.
 */
public class StoreHostResolver {

    private static final Logger log = LoggerFactory.getLogger(StoreHostResolver.class);

    private final Predicate<String> resolvable;

    public StoreHostResolver() {
        this(StoreHostResolver::resolvesViaDns);
    }

    public StoreHostResolver(Predicate<String> resolvable) {
        this.resolvable = resolvable;
    }

    public String resolve(StoreProperties props) {
        String host = props.getHost();
        if (resolvable.test(host)) {
            return host;
        }
        if (props.isAllowFallback()) {
            log.warn("Store host {} is not resolvable, falling back to {}", host, props.getFallbackHost());
            return props.getFallbackHost();
        }
        log.warn("Store host {} is not resolvable and fallback is disabled", host);
        return host;
    }

    private static boolean resolvesViaDns(String host) {
        try {
            InetAddress.getByName(host);
            return true;
        } catch (UnknownHostException e) {
            return false;
        }
    }
}
