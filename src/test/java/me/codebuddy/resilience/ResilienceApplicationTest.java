package me.codebuddy.resilience;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ResilienceApplicationTest {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(ResilienceApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ResilienceApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ResilienceApplication.class.getMethod("main", String[].class));
    }
}
