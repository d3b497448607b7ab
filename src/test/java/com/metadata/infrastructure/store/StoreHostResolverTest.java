package com.metadata.infrastructure.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StoreHostResolverTest {

    private StoreProperties props;

    @BeforeEach
    void setUp() {
        props = new StoreProperties();
        props.setHost("postgres");
        props.setFallbackHost("localhost");
    }

    @Test
    void shouldKeepResolvableHost() {
        props.setAllowFallback(true);
        StoreHostResolver resolver = new StoreHostResolver(host -> true);

        assertEquals("postgres", resolver.resolve(props));
    }

    @Test
    void shouldFallBackWhenAllowed() {
        props.setAllowFallback(true);
        StoreHostResolver resolver = new StoreHostResolver(host -> false);

        assertEquals("localhost", resolver.resolve(props));
    }

    @Test
    void shouldKeepUnresolvableHostWhenFallbackDisabled() {
        StoreHostResolver resolver = new StoreHostResolver(host -> false);

        assertEquals("postgres", resolver.resolve(props));
    }

    @Test
    void shouldResolveLocalhostViaDns() {
        props.setHost("localhost");
        props.setAllowFallback(true);
        props.setFallbackHost("fallback.invalid");

        assertEquals("localhost", new StoreHostResolver().resolve(props));
    }
}
