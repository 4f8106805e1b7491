package me.golemcore.arena;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ArenaResolverApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(ArenaResolverApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ArenaResolverApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ArenaResolverApplication.class.getMethod("main", String[].class));
    }
}
