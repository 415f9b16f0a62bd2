package org.iceforge.warden.server.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.PropertySourcesPropertyResolver;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/** Resolves the shipped application.yml with no environment overrides. */
class ApplicationYamlDefaultsTest {

    private PropertySourcesPropertyResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        List<PropertySource<?>> loaded = new YamlPropertySourceLoader()
                .load("application.yml", new ClassPathResource("application.yml"));
        MutablePropertySources sources = new MutablePropertySources();
        loaded.forEach(sources::addLast);
        resolver = new PropertySourcesPropertyResolver(sources);
    }

    @Test
    void demoDatasetIsOffUnlessAskedFor() {
        assertEquals(Boolean.FALSE, resolver.getProperty("warden.demo.h2.enabled", Boolean.class));
    }

    @Test
    void authDefaultsToThirtyMinuteTokensAndAGeneratedSecret() {
        assertEquals("30m", resolver.getProperty("warden.auth.token-ttl"));
        assertEquals("", resolver.getProperty("warden.auth.secret"));
        assertEquals("warden", resolver.getProperty("warden.auth.issuer"));
    }
}
